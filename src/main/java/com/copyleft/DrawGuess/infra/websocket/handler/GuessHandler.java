package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.game.GuessService;
import com.copyleft.DrawGuess.feature.game.dto.GuessRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class GuessHandler implements WebSocketCommandHandler {

    private final GuessService guessService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "guess";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        if (payload == null) return;
        try {
            GuessRequest dto = objectMapper.treeToValue(payload, GuessRequest.class);
            if (dto != null) {
                guessService.guess(session.getId(), dto.getText());
            }
        } catch (JsonProcessingException e) {
            log.warn("[guess] 요청 파싱 실패: session={}, msg={}", session.getId(), e.getMessage());
        }
    }
}

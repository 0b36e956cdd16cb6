package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.game.GameFlowService;
import com.copyleft.DrawGuess.feature.game.dto.SelectWordRequest;
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
public class SelectWordHandler implements WebSocketCommandHandler {

    private final GameFlowService gameFlowService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "select-word";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        String selectedWord = null;
        if (payload != null) {
            try {
                SelectWordRequest dto = objectMapper.treeToValue(payload, SelectWordRequest.class);
                selectedWord = dto != null ? dto.getSelectedWord() : null;
            } catch (JsonProcessingException e) {
                log.warn("[select-word] 요청 파싱 실패: session={}, msg={}", session.getId(), e.getMessage());
            }
        }
        gameFlowService.selectWord(session.getId(), selectedWord);
    }
}

package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.game.GameFlowService;
import com.copyleft.DrawGuess.feature.game.dto.StartGameRequest;
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
public class StartGameHandler implements WebSocketCommandHandler {

    private final GameFlowService gameFlowService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "start-game";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        StartGameRequest request = null;
        if (payload != null && payload.isObject()) {
            try {
                request = objectMapper.treeToValue(payload, StartGameRequest.class);
            } catch (JsonProcessingException e) {
                // 설정값이 잘못되면 기본값으로 시작
                log.warn("[start-game] 설정 파싱 실패, 기본값 사용: session={}, msg={}", session.getId(), e.getMessage());
            }
        }
        gameFlowService.startGame(session.getId(), request);
    }
}

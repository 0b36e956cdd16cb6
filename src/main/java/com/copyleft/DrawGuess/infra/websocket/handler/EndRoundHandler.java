package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.game.GameFlowService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class EndRoundHandler implements WebSocketCommandHandler {

    private final GameFlowService gameFlowService;

    @Override
    public String getAction() {
        return "end-round";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        gameFlowService.manualEndRound(session.getId());
    }
}

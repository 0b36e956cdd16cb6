package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.drawing.DrawRelayService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class DrawHandler implements WebSocketCommandHandler {

    private final DrawRelayService drawRelayService;

    @Override
    public String getAction() {
        return "draw";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        drawRelayService.relayDraw(session.getId(), payload);
    }
}

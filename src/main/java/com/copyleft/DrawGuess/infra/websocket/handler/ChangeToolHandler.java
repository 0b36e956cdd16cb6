package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.drawing.DrawRelayService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class ChangeToolHandler implements WebSocketCommandHandler {

    private final DrawRelayService drawRelayService;

    @Override
    public String getAction() {
        return "change-tool";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        if (payload == null) return;
        String tool = payload.hasNonNull("tool") ? payload.get("tool").asText() : null;
        drawRelayService.changeTool(session.getId(), tool, payload.get("size"));
    }
}

package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.presence.PresenceService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class JoinRoomHandler implements WebSocketCommandHandler {

    private final PresenceService presenceService;

    @Override
    public String getAction() {
        return "join-room";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        String roomCode = text(payload, "roomCode");
        String userId = text(payload, "userId");
        presenceService.join(session.getId(), roomCode, userId);
    }

    private String text(JsonNode payload, String field) {
        return (payload != null && payload.hasNonNull(field)) ? payload.get(field).asText() : null;
    }
}

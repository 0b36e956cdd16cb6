package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.presence.PresenceService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class LeaveRoomHandler implements WebSocketCommandHandler {

    private final PresenceService presenceService;

    @Override
    public String getAction() {
        return "leave-room";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        presenceService.leave(session.getId());
    }
}

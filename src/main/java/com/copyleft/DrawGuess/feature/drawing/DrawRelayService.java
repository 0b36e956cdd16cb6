package com.copyleft.DrawGuess.feature.drawing;

import com.copyleft.DrawGuess.feature.presence.PresenceBinding;
import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import com.copyleft.DrawGuess.infra.websocket.dto.WebSocketResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 그림 데이터 중계. 방 상태를 건드리지 않으므로 락 없이 보낸 사람을 제외한 방 전체에 전달한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrawRelayService {

    private final PresenceTracker presenceTracker;
    private final WebSocketSender webSocketSender;
    private final ObjectMapper objectMapper;

    public void relayDraw(String sessionId, JsonNode payload) {
        Optional<PresenceBinding> binding = presenceTracker.findBinding(sessionId);
        if (binding.isEmpty()) return;

        ObjectNode data = (payload != null && payload.isObject())
                ? ((ObjectNode) payload).deepCopy()
                : objectMapper.createObjectNode();
        data.put("userId", binding.get().userId());

        relay(sessionId, binding.get(), SocketEvent.DRAW_UPDATE, data);
    }

    public void clearCanvas(String sessionId) {
        Optional<PresenceBinding> binding = presenceTracker.findBinding(sessionId);
        if (binding.isEmpty()) return;

        ObjectNode data = objectMapper.createObjectNode();
        data.put("userId", binding.get().userId());
        data.put("timestamp", System.currentTimeMillis());

        relay(sessionId, binding.get(), SocketEvent.CANVAS_CLEARED, data);
    }

    public void changeColor(String sessionId, String color) {
        Optional<PresenceBinding> binding = presenceTracker.findBinding(sessionId);
        if (binding.isEmpty() || color == null || color.isBlank()) return;

        ObjectNode data = objectMapper.createObjectNode();
        data.put("userId", binding.get().userId());
        data.put("color", color);
        data.put("timestamp", System.currentTimeMillis());

        relay(sessionId, binding.get(), SocketEvent.COLOR_CHANGED, data);
    }

    public void changeTool(String sessionId, String tool, JsonNode size) {
        Optional<PresenceBinding> binding = presenceTracker.findBinding(sessionId);
        if (binding.isEmpty() || tool == null || tool.isBlank()) return;

        ObjectNode data = objectMapper.createObjectNode();
        data.put("userId", binding.get().userId());
        data.put("tool", tool);
        data.set("size", size);
        data.put("timestamp", System.currentTimeMillis());

        relay(sessionId, binding.get(), SocketEvent.TOOL_CHANGED, data);
    }

    private void relay(String sessionId, PresenceBinding binding, SocketEvent event, ObjectNode data) {
        WebSocketResponse<ObjectNode> response = WebSocketResponse.<ObjectNode>builder()
                .event(event.getValue())
                .data(data)
                .build();

        webSocketSender.broadcastToRoom(binding.roomCode(), response, sessionId);
    }
}

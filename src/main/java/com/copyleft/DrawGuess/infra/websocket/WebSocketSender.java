package com.copyleft.DrawGuess.infra.websocket;

import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Objects;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender {

    private final WebSocketSessionManager sessionManager;
    private final PresenceTracker presenceTracker;
    private final ObjectMapper objectMapper;

    public void sendEventToSession(String sessionId, Object event) {
        String payload = serialize(event);
        if (payload != null) {
            sendLocal(sessionId, payload);
        }
    }

    public void broadcastToRoom(String roomCode, Object event) {
        broadcastToRoom(roomCode, event, null);
    }

    /**
     * 방 브로드캐스트 그룹 전체에 전송. excludeSessionId 는 그림 중계처럼 보낸 사람을 빼야 할 때 사용.
     */
    public void broadcastToRoom(String roomCode, Object event, String excludeSessionId) {
        String payload = serialize(event);
        if (payload == null) return;

        for (String sessionId : presenceTracker.sessionsInRoom(roomCode)) {
            if (!Objects.equals(sessionId, excludeSessionId)) {
                sendLocal(sessionId, payload);
            }
        }
        log.debug("브로드캐스트: room={}, payload={}", roomCode, payload);
    }

    private String serialize(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("메시지 변환 실패: event={}", event.getClass().getSimpleName(), e);
            return null;
        }
    }

    // 끊긴 연결로의 전송 실패는 무시한다 (로그만)
    private void sendLocal(String sessionId, String payload) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session == null || !session.isOpen()) {
            log.debug("세션을 찾을 수 없거나 닫혀있습니다: {}", sessionId);
            return;
        }

        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException | RuntimeException e) {
            log.warn("전송 실패: session={}, msg={}", sessionId, e.getMessage());
        }
    }
}

package com.copyleft.DrawGuess.infra.websocket.handler;

import com.copyleft.DrawGuess.feature.chat.ChatService;
import com.copyleft.DrawGuess.feature.chat.dto.ChatRequest;
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
public class ChatMessageHandler implements WebSocketCommandHandler {

    private final ChatService chatService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "chat-message";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        String message = null;
        if (payload != null) {
            try {
                ChatRequest dto = objectMapper.treeToValue(payload, ChatRequest.class);
                message = dto != null ? dto.getMessage() : null;
            } catch (JsonProcessingException e) {
                log.warn("[chat-message] 요청 파싱 실패: session={}, msg={}", session.getId(), e.getMessage());
            }
        }
        chatService.processChat(session.getId(), message);
    }
}

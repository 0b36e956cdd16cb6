package com.copyleft.DrawGuess.feature.chat;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.feature.chat.dto.ChatResponse;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import com.copyleft.DrawGuess.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChatResponseSender {

    private final WebSocketSender webSocketSender;

    public void broadcastChat(String roomCode, Player sender, String message) {
        ChatResponse chatData = ChatResponse.builder()
                .userId(sender.getId())
                .nickname(sender.getNickname())
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();

        WebSocketResponse<ChatResponse> response = WebSocketResponse.<ChatResponse>builder()
                .event(SocketEvent.CHAT_MESSAGE.getValue())
                .data(chatData)
                .build();

        webSocketSender.broadcastToRoom(roomCode, response);
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.ERROR.getValue())
                .code(errorCode.name())
                .message(errorCode.getMessage())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }
}

package com.copyleft.DrawGuess.infra.websocket.handler;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.socket.WebSocketSession;

/**
 * action 하나를 담당하는 핸들러. 빈으로 등록하면 라우터가 getAction() 으로 찾아 호출한다.
 */
public interface WebSocketCommandHandler {

    String getAction();

    void handle(WebSocketSession session, JsonNode payload);
}

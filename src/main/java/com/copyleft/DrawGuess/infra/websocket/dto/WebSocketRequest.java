package com.copyleft.DrawGuess.infra.websocket.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketRequest {

    private String action;   // join-room, guess, draw ...

    private JsonNode payload;
}

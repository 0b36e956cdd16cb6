package com.copyleft.DrawGuess.infra.messaging.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class GameServiceRequest {
    private String id;
    private String action;   // check-guess, get-current-drawer
    private JsonNode data;
    private String replyTo;  // 응답을 받을 토픽
}

package com.copyleft.DrawGuess.infra.messaging.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class GameServiceResponse {
    private String requestId;
    private Object data;
}

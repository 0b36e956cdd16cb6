package com.copyleft.DrawGuess.infra.messaging.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameEventMessage {
    private String type;      // game-started, correct-guess ...
    private String roomCode;
    private Object data;
    private long timestamp;
}

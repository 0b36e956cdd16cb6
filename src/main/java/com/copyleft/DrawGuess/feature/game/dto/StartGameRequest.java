package com.copyleft.DrawGuess.feature.game.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class StartGameRequest {
    // 비어 있거나 0 이하이면 기본값
    private Integer rounds;
    private Integer maxPlayers;
    private Integer roundDuration;
}

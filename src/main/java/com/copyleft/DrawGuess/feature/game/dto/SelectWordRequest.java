package com.copyleft.DrawGuess.feature.game.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SelectWordRequest {
    private String selectedWord;
}

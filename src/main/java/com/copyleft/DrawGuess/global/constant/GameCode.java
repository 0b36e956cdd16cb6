package com.copyleft.DrawGuess.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum GameCode {

    USER_JOINED("%s joined the room"),
    USER_LEFT("%s left the room"),
    USER_LEFT_GAME_ENDED("%s left the room - Game ended due to insufficient players"),

    GAME_STARTED("Game started! %d rounds, %ds per round"),
    CHOOSE_WORD("Choose a word to draw!"),
    NOW_DRAWING("%s is now drawing!"),
    YOU_ARE_DRAWING("You are drawing: %s"),
    CORRECT_GUESS("%s guessed \"%s\" correctly! (+%d points, %s gets +%d points)"),
    NEW_ROUND("Round %d/%d starting! %s's turn to draw."),
    GAME_ENDED("Game ended! %s"),
    GAME_ENDED_INSUFFICIENT("Game ended due to insufficient players. %s"),
    GAME_RESTARTED("Game restarted! Waiting for host to configure settings and start a new game.");

    private final String message;

    public String format(Object... args) {
        return String.format(this.message, args);
    }
}

package com.copyleft.DrawGuess.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    INVALID_JOIN_REQUEST("Room code and user ID are required"),
    ROOM_NOT_FOUND("Room not found"),
    USER_NOT_IN_ROOM("User not found in this room"),
    NOT_IN_ROOM("Not in a room"),

    NOT_HOST_START("Only the host can start the game"),
    NOT_HOST_RESTART("Only the host can restart the game"),
    NOT_DRAWER("Only the current drawer can select a word"),
    NOT_ROUND_OWNER("Only the host or the current drawer can end the round"),

    NOT_ENOUGH_PLAYERS("Need at least 2 players to start"),
    TOO_MANY_PLAYERS("Too many players. Max allowed: %d"),
    INVALID_WORD_SELECTION("Invalid word selection"),

    CHAT_EMPTY("Message is empty"),
    CHAT_BLOCKED_FOR_DRAWER("The drawer can not chat while drawing"),

    SERVER_ERROR("Server error");

    private final String message;

    public String format(Object... args) {
        return String.format(this.message, args);
    }
}

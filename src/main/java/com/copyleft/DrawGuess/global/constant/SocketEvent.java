package com.copyleft.DrawGuess.global.constant;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SocketEvent {
    USER_JOINED("user-joined"),
    ROOM_JOINED("room-joined"),   // 입장한 본인에게만
    USER_LEFT("user-left"),

    GAME_STARTED("game-started"),
    WORD_OPTIONS("word-options"), // 출제자 전용
    WORD_SELECTED("word-selected"),
    DRAWER_WORD("drawer-word"),   // 출제자 전용 (정답 평문)
    CORRECT_GUESS("correct-guess"),
    NEW_ROUND("new-round"),
    GAME_ENDED("game-ended"),
    GAME_RESTARTED("game-restarted"),

    CLEAR_CANVAS_ROUND("clear-canvas-round"),
    CLEAR_CANVAS_GAME_END("clear-canvas-game-end"),

    CHAT_MESSAGE("chat-message"),

    DRAW_UPDATE("draw-update"),
    CANVAS_CLEARED("canvas-cleared"),
    COLOR_CHANGED("color-changed"),
    TOOL_CHANGED("tool-changed"),

    ERROR("error");

    private final String value;
}

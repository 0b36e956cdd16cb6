package com.copyleft.DrawGuess.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum GamePhase {
    WAITING("waiting"),               // 대기실
    WORD_SELECTION("word-selection"), // 출제자 단어 선택 중
    DRAWING("drawing"),               // 그림 그리는 중 (정답 입력 가능)
    GAME_END("game-end");             // 게임 종료 (재시작 대기)

    @JsonValue
    private final String code;

    @JsonCreator
    public static GamePhase fromCode(String code) {
        for (GamePhase phase : values()) {
            if (phase.code.equals(code) || phase.name().equals(code)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown game phase: " + code);
    }
}

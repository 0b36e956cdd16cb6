package com.copyleft.DrawGuess.domain.type;

public enum GuessOutcome {
    NOT_ACTIVE,      // drawing 단계가 아님
    DRAWER,          // 출제자는 맞힐 수 없음
    ALREADY_GUESSED, // 이번 라운드에 이미 맞힌 플레이어
    INCORRECT,
    CORRECT;

    public boolean isGameActive() {
        return this != NOT_ACTIVE;
    }
}

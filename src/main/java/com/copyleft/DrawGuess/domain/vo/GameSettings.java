package com.copyleft.DrawGuess.domain.vo;

public record GameSettings(
        int rounds,        // 총 라운드 수
        int maxPlayers,    // 최대 인원
        int roundDuration  // 라운드 제한 시간 (초)
) {}

package com.copyleft.DrawGuess.config;

import com.copyleft.DrawGuess.domain.vo.GameSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.rule")
public record GameProperties(
        // 게임 기본값 (start-game 요청에 값이 없을 때, 재시작 시)
        int defaultRounds,          // 기본 3
        int defaultMaxPlayers,      // 기본 10
        int defaultRoundDuration,   // 기본 60 (초)

        // 게임 룰 설정
        int minPlayers,             // 게임 시작 최소 인원 (2)
        int wordOptionCount,        // 출제자에게 제시할 단어 수 (3)
        long correctGuessDelayMillis, // 정답 후 라운드 종료까지 대기

        // 캐시
        long roomTtlSeconds         // 방 TTL (쓰기마다 갱신)
) {

    public GameSettings defaultSettings() {
        return new GameSettings(defaultRounds, defaultMaxPlayers, defaultRoundDuration);
    }
}

package com.copyleft.DrawGuess.domain.vo;

import com.copyleft.DrawGuess.domain.Player;

import java.util.List;

/**
 * 게임 종료 시 최종 순위.
 * winners 는 최고 점수를 공유하는 모든 플레이어 (동점 시 여러 명).
 */
public record GameResult(
        List<Player> winners,
        List<Player> finalScores,
        String summary
) {
    public Player winner() {
        return winners.get(0);
    }
}

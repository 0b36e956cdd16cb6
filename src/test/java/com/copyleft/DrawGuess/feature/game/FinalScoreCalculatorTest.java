package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.vo.GameResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FinalScoreCalculatorTest {

    private final FinalScoreCalculator calculator = new FinalScoreCalculator();

    private Player player(String nickname, int score) {
        return Player.builder().id(nickname.toLowerCase()).nickname(nickname).score(score).build();
    }

    @Test
    @DisplayName("[100,100,50] 이면 100점 두 명이 공동 우승이다")
    void rank_TwoWayTie() {
        // given
        List<Player> players = new ArrayList<>(List.of(
                player("Amy", 100), player("Ben", 50), player("Cal", 100)));

        // when
        GameResult result = calculator.rank(players);

        // then
        assertEquals(2, result.winners().size());
        assertEquals(List.of("Amy", "Cal"), result.winners().stream().map(Player::getNickname).toList());
        assertEquals(List.of(100, 100, 50), result.finalScores().stream().map(Player::getScore).toList());
        assertEquals("All but one tied for first! Winners: Amy and Cal with 100 points!", result.summary());
    }

    @Test
    @DisplayName("순위 계산이 원래 플레이어 순서를 바꾸지 않는다")
    void rank_DoesNotReorderInput() {
        List<Player> players = new ArrayList<>(List.of(player("Amy", 10), player("Ben", 30)));

        calculator.rank(players);

        assertEquals("Amy", players.get(0).getNickname());
    }

    @Test
    @DisplayName("단독 우승")
    void rank_SingleWinner() {
        GameResult result = calculator.rank(List.of(player("Amy", 10), player("Ben", 30), player("Cal", 20)));

        assertEquals("Ben", result.winner().getNickname());
        assertEquals("Winner: Ben with 30 points!", result.summary());
    }

    @Test
    @DisplayName("전원 동점이면 모두 우승자로 나열된다")
    void rank_AllTied() {
        GameResult result = calculator.rank(List.of(player("Amy", 0), player("Ben", 0), player("Cal", 0)));

        assertEquals(3, result.winners().size());
        assertEquals("Everyone tied with 0 points! Winners: Amy, Ben and Cal", result.summary());
    }

    @Test
    @DisplayName("일부 동점 (4명 중 2명)")
    void rank_PartialTie() {
        GameResult result = calculator.rank(List.of(
                player("Amy", 40), player("Ben", 40), player("Cal", 10), player("Dan", 5)));

        assertEquals(2, result.winners().size());
        assertEquals("It's a tie! Winners: Amy and Ben with 40 points!", result.summary());
    }

    @Test
    @DisplayName("플레이어가 없으면 No one 0점이 우승자 자리를 채운다")
    void rank_EmptyRoom() {
        GameResult result = calculator.rank(List.of());

        assertEquals("No one", result.winner().getNickname());
        assertEquals(0, result.winner().getScore());
        assertTrue(result.finalScores().isEmpty());
    }
}

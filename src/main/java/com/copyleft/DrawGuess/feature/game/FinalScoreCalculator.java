package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.vo.GameResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 최종 순위 계산. 점수 내림차순, 최고 점수 동점자는 모두 공동 우승.
 */
@Component
public class FinalScoreCalculator {

    static final String NO_ONE = "No one";

    public GameResult rank(List<Player> players) {
        if (players == null || players.isEmpty()) {
            Player placeholder = Player.builder().nickname(NO_ONE).score(0).build();
            return new GameResult(List.of(placeholder), List.of(), NO_ONE + " wins!");
        }

        // 원본 users 순서(출제 순서)는 건드리지 않는다
        List<Player> sorted = new ArrayList<>(players);
        sorted.sort(Comparator.comparingInt(Player::getScore).reversed());

        int topScore = sorted.get(0).getScore();
        List<Player> winners = sorted.stream()
                .filter(p -> p.getScore() == topScore)
                .toList();

        return new GameResult(winners, sorted, summarize(winners, sorted.size(), topScore));
    }

    private String summarize(List<Player> winners, int playerCount, int topScore) {
        String names = joinNicknames(winners);

        if (winners.size() == 1) {
            return String.format("Winner: %s with %d points!", names, topScore);
        }
        if (winners.size() == playerCount) {
            return String.format("Everyone tied with %d points! Winners: %s", topScore, names);
        }
        if (winners.size() == playerCount - 1) {
            return String.format("All but one tied for first! Winners: %s with %d points!", names, topScore);
        }
        return String.format("It's a tie! Winners: %s with %d points!", names, topScore);
    }

    private String joinNicknames(List<Player> winners) {
        List<String> names = winners.stream().map(Player::getNickname).toList();
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + " and " + names.get(names.size() - 1);
    }
}

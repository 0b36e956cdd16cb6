package com.copyleft.DrawGuess.feature.game.dto;

import com.copyleft.DrawGuess.domain.Player;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class GamePayloads {

    // 입장 알림 (방 전체)
    @Getter
    @Builder
    public static class UserJoined {
        private Player user;
        private List<Player> users;
    }

    // 입장 확인 (본인)
    @Getter
    @Builder
    public static class RoomJoined {
        private RoomSnapshot room;
    }

    @Getter
    @Builder
    public static class UserLeft {
        private String userId;
        private List<Player> users;
    }

    // game-started, new-round, game-restarted
    @Getter
    @Builder
    public static class RoomState {
        private RoomSnapshot room;
    }

    // 제시어 후보 (출제자 전용)
    @Getter
    @Builder
    public static class WordOptions {
        private List<String> words;
    }

    @Getter
    @Builder
    public static class WordSelected {
        private RoomSnapshot room;
        private String wordDisplay;   // "___ ___"
        private int roundDuration;
        private Long roundEndTime;
    }

    // 정답 평문 (출제자 전용)
    @Getter
    @Builder
    public static class DrawerWord {
        private String word;
    }

    @Getter
    @Builder
    public static class CorrectGuess {
        private String userId;
        private String username;
        private String word;
        private int points;
        private int totalScore;
        private int drawerPoints;
        private int drawerScore;
    }

    @Getter
    @Builder
    public static class GameEnded {
        private RoomSnapshot room;
        private Player winner;
        private List<Player> winners;
        private List<Player> finalScores;
    }

    @Getter
    @Builder
    public static class CanvasClear {
        private String roomCode;
    }
}

package com.copyleft.DrawGuess.feature.game.dto;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.GamePhase;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 클라이언트로 내보내는 방 상태. 정답 단어와 제시어 후보는 개인 이벤트로만 전달하므로 제외한다.
 */
@Getter
@Builder
public class RoomSnapshot {
    private String roomCode;
    private List<Player> users;
    private boolean gameStarted;
    private GamePhase gamePhase;
    private int rounds;
    private int currentRound;
    private String currentDrawer;
    private Long roundStartTime;
    private Long roundEndTime;
    private int maxPlayers;
    private int roundDuration;
    private long createdAt;

    public static RoomSnapshot from(Room room) {
        return RoomSnapshot.builder()
                .roomCode(room.getRoomCode())
                .users(List.copyOf(room.getUsers()))
                .gameStarted(room.isGameStarted())
                .gamePhase(room.getGamePhase())
                .rounds(room.getRounds())
                .currentRound(room.getCurrentRound())
                .currentDrawer(room.getCurrentDrawer())
                .roundStartTime(room.getRoundStartTime())
                .roundEndTime(room.getRoundEndTime())
                .maxPlayers(room.getMaxPlayers())
                .roundDuration(room.getRoundDuration())
                .createdAt(room.getCreatedAt())
                .build();
    }
}

package com.copyleft.DrawGuess.feature.room.dto;

import com.copyleft.DrawGuess.feature.game.dto.RoomSnapshot;
import lombok.Builder;
import lombok.Getter;

public class RoomResponses {

    // POST /rooms
    @Getter
    @Builder
    public static class Created {
        private String roomCode;
        private String userId;
        private String joinUrl;
    }

    // POST /rooms/{code}/join
    @Getter
    @Builder
    public static class Joined {
        private String roomCode;
        private String userId;
        private RoomSnapshot room;
    }

    // GET /rooms/{code}
    @Getter
    @Builder
    public static class Detail {
        private String roomCode;
        private RoomSnapshot room;
    }
}

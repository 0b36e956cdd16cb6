package com.copyleft.DrawGuess.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Getter
@Setter
@Builder
@Jacksonized
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Player {

    private String id;        // 방 안에서의 유저 ID
    private String nickname;  // 표시용 닉네임

    @JsonProperty("isHost")
    private boolean host;     // 방장 여부

    private int score;
    private long joinedAt;

    public static Player createHost(String id, String nickname) {
        return Player.builder()
                .id(id)
                .nickname(nickname)
                .host(true)
                .score(0)
                .joinedAt(System.currentTimeMillis())
                .build();
    }

    public static Player createGuest(String id, String nickname) {
        return Player.builder()
                .id(id)
                .nickname(nickname)
                .host(false)
                .score(0)
                .joinedAt(System.currentTimeMillis())
                .build();
    }

    public void addScore(int points) {
        if (points > 0) {
            this.score += points;
        }
    }

    public void resetScore() {
        this.score = 0;
    }
}

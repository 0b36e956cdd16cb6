package com.copyleft.DrawGuess.domain;

import com.copyleft.DrawGuess.domain.type.GamePhase;
import com.copyleft.DrawGuess.domain.vo.GameSettings;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Getter
@Setter
@Builder
@Jacksonized
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Room {

    public static final int DEFAULT_ROUNDS = 3;
    public static final int DEFAULT_MAX_PLAYERS = 10;
    public static final int DEFAULT_ROUND_DURATION = 60;

    private String roomCode;      // 유저 공유용 코드 (캐시 키)

    @Builder.Default
    private List<Player> users = new ArrayList<>(); // 입장 순서 = 출제 순서

    private boolean gameStarted;

    @Builder.Default
    private GamePhase gamePhase = GamePhase.WAITING;

    @Builder.Default
    private int rounds = DEFAULT_ROUNDS;

    private int currentRound;     // 게임 시작 전에는 0

    private String currentDrawer; // 출제자 userId
    private String currentWord;   // drawing 단계에서만 존재
    private List<String> wordOptions; // word-selection 단계에서만 존재

    private Long roundStartTime;
    private Long roundEndTime;

    @Builder.Default
    private int maxPlayers = DEFAULT_MAX_PLAYERS;

    @Builder.Default
    private int roundDuration = DEFAULT_ROUND_DURATION; // 초 단위

    @Builder.Default
    private long createdAt = System.currentTimeMillis();

    @Builder.Default
    private List<String> correctGuessers = new ArrayList<>(); // 이번 라운드 정답자

    public static Room create(String roomCode, Player host) {
        Room room = Room.builder()
                .roomCode(roomCode)
                .gamePhase(GamePhase.WAITING)
                .createdAt(System.currentTimeMillis())
                .build();

        room.addUser(host);
        return room;
    }

    public void addUser(Player player) {
        if (this.users == null) {
            this.users = new ArrayList<>();
        }
        this.users.add(player);
    }

    public Optional<Player> findUser(String userId) {
        if (this.users == null || userId == null) return Optional.empty();

        return this.users.stream()
                .filter(p -> Objects.equals(p.getId(), userId))
                .findFirst();
    }

    public boolean hasNickname(String nickname) {
        return this.users != null && this.users.stream()
                .anyMatch(p -> Objects.equals(p.getNickname(), nickname));
    }

    public int indexOfUser(String userId) {
        if (this.users == null) return -1;

        for (int i = 0; i < this.users.size(); i++) {
            if (Objects.equals(this.users.get(i).getId(), userId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 플레이어를 제거한다. 방장이 나간 경우 새 방장 위임은 호출 측에서 {@link #delegateHost()} 로 처리.
     */
    public Optional<Player> removeUser(String userId) {
        int index = indexOfUser(userId);
        if (index < 0) return Optional.empty();

        Player removed = this.users.remove(index);
        if (this.correctGuessers != null) {
            this.correctGuessers.remove(userId);
        }
        return Optional.of(removed);
    }

    public String delegateHost() {
        if (isEmpty()) {
            return null;
        }

        for (Player p : this.users) {
            p.setHost(false);
        }

        Player newHost = this.users.get(0);
        newHost.setHost(true);
        return newHost.getId();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return this.users == null || this.users.isEmpty();
    }

    @JsonIgnore
    public int getUserCount() {
        return this.users == null ? 0 : this.users.size();
    }

    public boolean isHostUser(String userId) {
        return findUser(userId).map(Player::isHost).orElse(false);
    }

    public boolean isDrawer(String userId) {
        return userId != null && userId.equals(this.currentDrawer);
    }

    @JsonIgnore
    public boolean isLastRound() {
        return this.currentRound >= this.rounds;
    }

    // 게임 진행

    public void startGame(GameSettings settings, String drawerId) {
        this.users.forEach(Player::resetScore);

        this.gameStarted = true;
        this.rounds = settings.rounds();
        this.maxPlayers = settings.maxPlayers();
        this.roundDuration = settings.roundDuration();
        this.currentRound = 1;
        this.currentDrawer = drawerId;

        clearRoundState();
        this.gamePhase = GamePhase.WORD_SELECTION;
    }

    public void offerWordOptions(List<String> options) {
        this.wordOptions = new ArrayList<>(options);
    }

    public boolean isWordOption(String word) {
        return this.wordOptions != null && this.wordOptions.contains(word);
    }

    public void selectWord(String word, long now) {
        this.currentWord = word;
        this.wordOptions = null;
        this.roundStartTime = now;
        this.roundEndTime = now + this.roundDuration * 1000L;
        this.gamePhase = GamePhase.DRAWING;
    }

    /**
     * 가려진 단어. 알파벳만 '_' 로 바꾸고 공백, 하이픈 등은 그대로 둔다.
     */
    @JsonIgnore
    public String getMaskedWord() {
        return this.currentWord == null ? null : this.currentWord.replaceAll("[a-zA-Z]", "_");
    }

    public boolean matchesCurrentWord(String text) {
        return this.currentWord != null && text != null
                && text.trim().equalsIgnoreCase(this.currentWord);
    }

    public boolean hasGuessedCorrectly(String userId) {
        return this.correctGuessers != null && this.correctGuessers.contains(userId);
    }

    public void recordCorrectGuess(String userId) {
        if (this.correctGuessers == null) {
            this.correctGuessers = new ArrayList<>();
        }
        this.correctGuessers.add(userId);
    }

    /**
     * 현재 출제자 다음 순서의 플레이어 (마지막이면 처음으로).
     */
    @JsonIgnore
    public String getNextDrawerId() {
        if (isEmpty()) return null;

        int currentIndex = indexOfUser(this.currentDrawer);
        int nextIndex = (currentIndex + 1) % this.users.size();
        return this.users.get(nextIndex).getId();
    }

    public void advanceRound(String nextDrawerId) {
        this.currentRound += 1;
        this.currentDrawer = nextDrawerId;

        clearRoundState();
        this.gamePhase = GamePhase.WORD_SELECTION;
    }

    public void endGame() {
        this.gameStarted = false;
        this.gamePhase = GamePhase.GAME_END;
        this.currentDrawer = null;

        clearRoundState();
    }

    public void resetForNewGame(GameSettings defaults) {
        this.gameStarted = false;
        this.gamePhase = GamePhase.WAITING;
        this.currentRound = 0;
        this.rounds = defaults.rounds();
        this.maxPlayers = defaults.maxPlayers();
        this.roundDuration = defaults.roundDuration();
        this.currentDrawer = null;

        clearRoundState();

        if (this.users != null) {
            this.users.forEach(Player::resetScore);
        }
    }

    private void clearRoundState() {
        this.currentWord = null;
        this.wordOptions = null;
        this.roundStartTime = null;
        this.roundEndTime = null;

        if (this.correctGuessers == null) {
            this.correctGuessers = new ArrayList<>();
        } else {
            this.correctGuessers.clear();
        }
    }
}

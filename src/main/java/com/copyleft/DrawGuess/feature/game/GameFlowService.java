package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.EndRoundTrigger;
import com.copyleft.DrawGuess.domain.type.GamePhase;
import com.copyleft.DrawGuess.domain.vo.GameResult;
import com.copyleft.DrawGuess.domain.vo.GameSettings;
import com.copyleft.DrawGuess.feature.game.dto.StartGameRequest;
import com.copyleft.DrawGuess.feature.presence.PresenceBinding;
import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.copyleft.DrawGuess.feature.word.WordBank;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.global.util.RandomUtil;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 방의 게임 진행 상태 전이 (시작, 제시어 선택, 라운드 종료, 재시작, 퇴장).
 * 모든 전이는 방 락 안에서 조회 → 검증 → 변경 → 저장 → 브로드캐스트 순으로 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameFlowService {

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final GameResponseSender gameResponseSender;
    private final PresenceTracker presenceTracker;
    private final RoundTimerRegistry roundTimerRegistry;
    private final WordBank wordBank;
    private final FinalScoreCalculator finalScoreCalculator;
    private final GameProperties gameProperties;


    // 게임 시작

    public void startGame(String sessionId, StartGameRequest request) {
        PresenceBinding binding = requireBinding(sessionId);
        if (binding == null) return;

        runInRoom(sessionId, binding.roomCode(), () -> {
            Room room = roomRepository.findByCode(binding.roomCode()).orElse(null);
            if (room == null) {
                gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }

            GameSettings settings = resolveSettings(request);
            if (!validateGameStart(room, binding.userId(), settings, sessionId)) return;

            roundTimerRegistry.cancel(room.getRoomCode());

            String drawerId = room.getUsers().get(RandomUtil.nextIndex(room.getUserCount())).getId();
            room.startGame(settings, drawerId);

            List<String> words = wordBank.randomWords(gameProperties.wordOptionCount());
            room.offerWordOptions(words);

            roomRepository.save(room);

            gameResponseSender.broadcastGameStarted(room, settings);
            gameResponseSender.sendWordOptions(room, drawerId, words);

            log.info("게임 시작: room={}, rounds={}, duration={}s, drawer={}",
                    room.getRoomCode(), settings.rounds(), settings.roundDuration(), drawerId);
        });
    }

    private boolean validateGameStart(Room room, String userId, GameSettings settings, String sessionId) {
        if (!room.isHostUser(userId)) {
            gameResponseSender.sendError(sessionId, ErrorCode.NOT_HOST_START);
            return false;
        }
        if (room.getUserCount() < gameProperties.minPlayers()) {
            gameResponseSender.sendError(sessionId, ErrorCode.NOT_ENOUGH_PLAYERS);
            return false;
        }
        if (room.getUserCount() > settings.maxPlayers()) {
            gameResponseSender.sendError(sessionId, ErrorCode.TOO_MANY_PLAYERS, settings.maxPlayers());
            return false;
        }
        return true;
    }

    GameSettings resolveSettings(StartGameRequest request) {
        GameSettings defaults = gameProperties.defaultSettings();
        if (request == null) {
            return defaults;
        }

        return new GameSettings(
                positiveOr(request.getRounds(), defaults.rounds()),
                positiveOr(request.getMaxPlayers(), defaults.maxPlayers()),
                positiveOr(request.getRoundDuration(), defaults.roundDuration())
        );
    }

    private int positiveOr(Integer value, int fallback) {
        return (value == null || value <= 0) ? fallback : value;
    }


    // 제시어 선택

    public void selectWord(String sessionId, String selectedWord) {
        PresenceBinding binding = requireBinding(sessionId);
        if (binding == null) return;

        if (!StringUtils.hasText(selectedWord)) {
            gameResponseSender.sendError(sessionId, ErrorCode.INVALID_WORD_SELECTION);
            return;
        }

        runInRoom(sessionId, binding.roomCode(), () -> {
            Room room = roomRepository.findByCode(binding.roomCode()).orElse(null);
            if (room == null) {
                gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            if (!room.isDrawer(binding.userId())) {
                gameResponseSender.sendError(sessionId, ErrorCode.NOT_DRAWER);
                return;
            }
            if (room.getGamePhase() != GamePhase.WORD_SELECTION || !room.isWordOption(selectedWord)) {
                gameResponseSender.sendError(sessionId, ErrorCode.INVALID_WORD_SELECTION);
                return;
            }

            room.selectWord(selectedWord, System.currentTimeMillis());
            roomRepository.save(room);

            Player drawer = room.findUser(binding.userId()).orElse(null);
            gameResponseSender.broadcastWordSelected(room, drawer);
            gameResponseSender.sendDrawerWord(sessionId, selectedWord);

            armRoundTimer(room);

            log.info("제시어 선택: room={}, round={}, drawer={}", room.getRoomCode(), room.getCurrentRound(), binding.userId());
        });
    }

    private void armRoundTimer(Room room) {
        String roomCode = room.getRoomCode();
        int round = room.getCurrentRound();

        roundTimerRegistry.arm(
                roomCode,
                Duration.ofSeconds(room.getRoundDuration()),
                () -> endRound(roomCode, EndRoundTrigger.TIME_UP, round)
        );
    }


    // 라운드 종료

    /**
     * 타이머(시간 종료, 정답 후 대기)에서 호출된다. 예약 당시 라운드가 이미 끝났다면 무시한다.
     */
    public void endRound(String roomCode, EndRoundTrigger trigger, int expectedRound) {
        runInRoom(null, roomCode, () -> {
            Room room = roomRepository.findByCode(roomCode).orElse(null);
            if (room == null) {
                roundTimerRegistry.cancel(roomCode);
                return;
            }

            if (!room.isGameStarted()
                    || room.getGamePhase() != GamePhase.DRAWING
                    || room.getCurrentRound() != expectedRound) {
                log.debug("지난 라운드 타이머 무시: room={}, trigger={}, expected={}, current={}",
                        roomCode, trigger, expectedRound, room.getCurrentRound());
                return;
            }

            finishRound(room, trigger, null);
        });
    }

    /**
     * end-round 액션. 방장 또는 현재 출제자만 가능.
     */
    public void manualEndRound(String sessionId) {
        PresenceBinding binding = requireBinding(sessionId);
        if (binding == null) return;

        runInRoom(sessionId, binding.roomCode(), () -> {
            Room room = roomRepository.findByCode(binding.roomCode()).orElse(null);
            if (room == null) {
                gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            if (!room.isHostUser(binding.userId()) && !room.isDrawer(binding.userId())) {
                gameResponseSender.sendError(sessionId, ErrorCode.NOT_ROUND_OWNER);
                return;
            }
            if (!room.isGameStarted()) {
                log.debug("진행 중인 게임 없음, end-round 무시: room={}", room.getRoomCode());
                return;
            }

            finishRound(room, EndRoundTrigger.MANUAL, null);
        });
    }

    /**
     * 락을 잡은 상태에서 호출. 마지막 라운드면 게임 종료, 아니면 다음 출제자로 넘긴다.
     *
     * @param nextDrawerId null 이면 현재 출제자 다음 순서
     */
    private void finishRound(Room room, EndRoundTrigger trigger, String nextDrawerId) {
        String roomCode = room.getRoomCode();
        roundTimerRegistry.cancel(roomCode);

        if (room.isLastRound()) {
            room.endGame();
            GameResult result = finalScoreCalculator.rank(room.getUsers());

            roomRepository.save(room);
            gameResponseSender.broadcastGameEnded(room, result, false);

            log.info("게임 종료: room={}, trigger={}, {}", roomCode, trigger, result.summary());
            return;
        }

        String nextDrawer = (nextDrawerId != null) ? nextDrawerId : room.getNextDrawerId();
        room.advanceRound(nextDrawer);

        List<String> words = wordBank.randomWords(gameProperties.wordOptionCount());
        room.offerWordOptions(words);

        roomRepository.save(room);

        Player drawer = room.findUser(nextDrawer).orElseThrow();
        gameResponseSender.broadcastNewRound(room, drawer);
        gameResponseSender.sendWordOptions(room, nextDrawer, words);

        log.info("라운드 {} 시작: room={}, trigger={}, drawer={}", room.getCurrentRound(), roomCode, trigger, nextDrawer);
    }


    // 재시작

    public void restartGame(String sessionId) {
        PresenceBinding binding = requireBinding(sessionId);
        if (binding == null) return;

        runInRoom(sessionId, binding.roomCode(), () -> {
            Room room = roomRepository.findByCode(binding.roomCode()).orElse(null);
            if (room == null) {
                gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                return;
            }
            if (!room.isHostUser(binding.userId())) {
                gameResponseSender.sendError(sessionId, ErrorCode.NOT_HOST_RESTART);
                return;
            }

            roundTimerRegistry.cancel(room.getRoomCode());
            room.resetForNewGame(gameProperties.defaultSettings());
            roomRepository.save(room);

            gameResponseSender.broadcastGameRestarted(room);
            log.info("게임 재시작: room={}, host={}", room.getRoomCode(), binding.userId());
        });
    }


    // 퇴장

    /**
     * 플레이어 제거. 명시적 퇴장과 연결 끊김 모두 여기로 온다.
     */
    public void removePlayer(String roomCode, String userId) {
        runInRoom(null, roomCode, () -> {
            Room room = roomRepository.findByCode(roomCode).orElse(null);
            if (room == null) return;

            int departedIndex = room.indexOfUser(userId);
            boolean wasDrawer = room.isDrawer(userId);

            Optional<Player> removedOpt = room.removeUser(userId);
            if (removedOpt.isEmpty()) return;
            Player removed = removedOpt.get();

            if (room.isEmpty()) {
                roundTimerRegistry.cancel(roomCode);
                roomRepository.delete(roomCode);
                presenceTracker.clearRoom(roomCode);
                log.info("마지막 플레이어 퇴장, 방 삭제: room={}", roomCode);
                return;
            }

            if (removed.isHost()) {
                String newHostId = room.delegateHost();
                log.info("방장 위임: room={}, newHost={}", roomCode, newHostId);
            }

            if (room.isGameStarted() && room.getUserCount() < gameProperties.minPlayers()) {
                forceGameEnd(room, removed);
                return;
            }

            if (room.isGameStarted() && wasDrawer) {
                // 나간 출제자 바로 뒤 순서였던 플레이어가 이어받는다
                String nextDrawer = room.getUsers().get(departedIndex % room.getUserCount()).getId();
                finishRound(room, EndRoundTrigger.DRAWER_LEFT, nextDrawer);
                gameResponseSender.broadcastUserLeft(room, removed, false);
                return;
            }

            roomRepository.save(room);
            gameResponseSender.broadcastUserLeft(room, removed, false);
            log.info("플레이어 퇴장: room={}, user={}", roomCode, userId);
        });
    }

    private void forceGameEnd(Room room, Player removed) {
        roundTimerRegistry.cancel(room.getRoomCode());
        room.endGame();

        // 남은 플레이어 기준으로 순위 계산
        GameResult result = finalScoreCalculator.rank(room.getUsers());
        roomRepository.save(room);

        gameResponseSender.broadcastGameEnded(room, result, true);
        gameResponseSender.broadcastUserLeft(room, removed, true);

        log.info("인원 부족으로 게임 종료: room={}, left={}", room.getRoomCode(), removed.getNickname());
    }


    private PresenceBinding requireBinding(String sessionId) {
        Optional<PresenceBinding> binding = presenceTracker.findBinding(sessionId);
        if (binding.isEmpty()) {
            gameResponseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return null;
        }
        return binding.get();
    }

    /**
     * 방 락 안에서 action 실행. 캐시 또는 락 장애 시 행동을 중단하고 요청자에게만 Server error 를 보낸다.
     */
    private void runInRoom(String sessionId, String roomCode, Runnable action) {
        try {
            LockResult<Void> result = lockFacade.execute(roomCode, action);
            if (result.isLockFailed()) {
                log.warn("방 락 획득 실패로 요청 중단: room={}, session={}", roomCode, sessionId);
                gameResponseSender.sendError(sessionId, ErrorCode.SERVER_ERROR);
            }
        } catch (BackendUnavailableException e) {
            log.error("캐시 장애로 요청 중단: room={}, session={}", roomCode, sessionId, e);
            gameResponseSender.sendError(sessionId, ErrorCode.SERVER_ERROR);
        }
    }
}

package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.EndRoundTrigger;
import com.copyleft.DrawGuess.domain.type.GamePhase;
import com.copyleft.DrawGuess.domain.type.GuessOutcome;
import com.copyleft.DrawGuess.feature.chat.ChatResponseSender;
import com.copyleft.DrawGuess.feature.presence.PresenceBinding;
import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.copyleft.DrawGuess.feature.word.WordBank;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class GuessService {

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final GameResponseSender gameResponseSender;
    private final ChatResponseSender chatResponseSender;
    private final PresenceTracker presenceTracker;
    private final RoundTimerRegistry roundTimerRegistry;
    private final WordBank wordBank;
    private final GameFlowService gameFlowService;
    private final GameProperties gameProperties;

    /**
     * guess 액션. 오답은 일반 채팅으로 방에 보여준다.
     */
    public void guess(String sessionId, String text) {
        Optional<PresenceBinding> bindingOpt = presenceTracker.findBinding(sessionId);
        if (bindingOpt.isEmpty()) {
            gameResponseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }
        if (!StringUtils.hasText(text)) {
            return;
        }
        PresenceBinding binding = bindingOpt.get();

        try {
            submitGuess(binding.roomCode(), binding.userId(), text, true);
        } catch (BackendUnavailableException e) {
            log.error("정답 확인 실패: room={}, user={}", binding.roomCode(), binding.userId(), e);
            gameResponseSender.sendError(sessionId, ErrorCode.SERVER_ERROR);
        }
    }

    /**
     * 락을 잡고 추측을 판정한다. 외부 서비스 요청(check-guess)은 echoIncorrect=false 로 호출한다.
     *
     * @throws BackendUnavailableException 캐시 장애 또는 락 획득 실패
     */
    public GuessOutcome submitGuess(String roomCode, String userId, String text, boolean echoIncorrect) {
        LockResult<GuessOutcome> result = lockFacade.execute(roomCode, () -> {
            Room room = roomRepository.findByCode(roomCode).orElse(null);
            if (room == null) {
                return GuessOutcome.NOT_ACTIVE;
            }
            return applyGuess(room, userId, text, echoIncorrect);
        });

        if (result.isLockFailed()) {
            throw new BackendUnavailableException("Room lock unavailable: " + roomCode, null);
        }
        return result.getData();
    }

    /**
     * 이미 방 락을 잡고 조회한 room 에 추측을 적용한다.
     */
    public GuessOutcome applyGuess(Room room, String userId, String text, boolean echoIncorrect) {
        if (!room.isGameStarted() || room.getGamePhase() != GamePhase.DRAWING) {
            return GuessOutcome.NOT_ACTIVE;
        }
        if (room.isDrawer(userId)) {
            return GuessOutcome.DRAWER;
        }

        Player guesser = room.findUser(userId).orElse(null);
        if (guesser == null) {
            return GuessOutcome.NOT_ACTIVE;
        }
        if (room.hasGuessedCorrectly(userId)) {
            return GuessOutcome.ALREADY_GUESSED;
        }

        if (!room.matchesCurrentWord(text)) {
            if (echoIncorrect) {
                chatResponseSender.broadcastChat(room.getRoomCode(), guesser, text);
            }
            return GuessOutcome.INCORRECT;
        }

        awardCorrectGuess(room, guesser);
        return GuessOutcome.CORRECT;
    }

    private void awardCorrectGuess(Room room, Player guesser) {
        int points = wordBank.pointsFor(room.getCurrentWord());
        int drawerPoints = points / 2;

        guesser.addScore(points);
        Player drawer = room.findUser(room.getCurrentDrawer()).orElse(null);
        if (drawer != null) {
            drawer.addScore(drawerPoints);
        }

        boolean firstCorrect = room.getCorrectGuessers().isEmpty();
        room.recordCorrectGuess(guesser.getId());

        roomRepository.save(room);
        gameResponseSender.broadcastCorrectGuess(room, guesser, drawer, points, drawerPoints);

        // 첫 정답자에서 라운드 타이머를 짧은 대기 타이머로 교체
        if (firstCorrect) {
            String roomCode = room.getRoomCode();
            int round = room.getCurrentRound();
            roundTimerRegistry.arm(
                    roomCode,
                    Duration.ofMillis(gameProperties.correctGuessDelayMillis()),
                    () -> gameFlowService.endRound(roomCode, EndRoundTrigger.CORRECT_GUESS, round)
            );
        }

        log.info("정답: room={}, user={}, +{} (drawer +{})", room.getRoomCode(), guesser.getId(), points, drawerPoints);
    }
}

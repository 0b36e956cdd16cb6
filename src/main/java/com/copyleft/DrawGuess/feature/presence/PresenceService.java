package com.copyleft.DrawGuess.feature.presence;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.game.GameFlowService;
import com.copyleft.DrawGuess.feature.game.GameResponseSender;
import com.copyleft.DrawGuess.feature.game.GameRoomLockFacade;
import com.copyleft.DrawGuess.feature.game.LockResult;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 연결 단위 입장/퇴장. 방 멤버십 자체는 REST 입장에서 만들어지고, 여기서는 연결을 묶고 푼다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceService {

    private final PresenceTracker presenceTracker;
    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final GameResponseSender gameResponseSender;
    private final GameFlowService gameFlowService;

    public void join(String sessionId, String roomCode, String userId) {
        if (!StringUtils.hasText(roomCode) || !StringUtils.hasText(userId)) {
            gameResponseSender.sendError(sessionId, ErrorCode.INVALID_JOIN_REQUEST);
            return;
        }

        PresenceBinding target = new PresenceBinding(roomCode, userId);
        Optional<PresenceBinding> previous = presenceTracker.findBinding(sessionId)
                .filter(binding -> !binding.equals(target));

        try {
            LockResult<Boolean> result = lockFacade.execute(roomCode, () -> {
                Room room = roomRepository.findByCode(roomCode).orElse(null);
                if (room == null) {
                    gameResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                    return null;
                }

                Player user = room.findUser(userId).orElse(null);
                if (user == null) {
                    gameResponseSender.sendError(sessionId, ErrorCode.USER_NOT_IN_ROOM);
                    return null;
                }

                presenceTracker.bind(sessionId, roomCode, userId);

                gameResponseSender.broadcastUserJoined(room, user);
                gameResponseSender.sendRoomJoined(sessionId, room);

                log.info("연결 입장: room={}, user={}, session={}", roomCode, userId, sessionId);
                return Boolean.TRUE;
            });

            if (result.isLockFailed()) {
                gameResponseSender.sendError(sessionId, ErrorCode.SERVER_ERROR);
                return;
            }

            // 같은 연결로 다른 방에 들어가면 이전 방에서는 퇴장 처리 (새 방 락을 놓은 뒤)
            if (result.isSuccess() && previous.isPresent()) {
                PresenceBinding old = previous.get();
                log.info("다른 방으로 이동, 이전 방 퇴장: room={}, user={}, session={}", old.roomCode(), old.userId(), sessionId);
                gameFlowService.removePlayer(old.roomCode(), old.userId());
            }
        } catch (BackendUnavailableException e) {
            log.error("입장 처리 실패: room={}, session={}", roomCode, sessionId, e);
            gameResponseSender.sendError(sessionId, ErrorCode.SERVER_ERROR);
        }
    }

    /**
     * leave-room 액션과 연결 종료 공통. 이미 다른 연결로 대체된 세션이면 플레이어를 제거하지 않는다.
     */
    public void leave(String sessionId) {
        Optional<PresenceBinding> binding = presenceTracker.unbind(sessionId);
        if (binding.isEmpty()) {
            log.debug("바인딩 없는 세션 퇴장 무시: {}", sessionId);
            return;
        }

        String roomCode = binding.get().roomCode();
        String userId = binding.get().userId();

        gameFlowService.removePlayer(roomCode, userId);
        log.info("연결 퇴장: room={}, user={}, session={}", roomCode, userId, sessionId);
    }
}

package com.copyleft.DrawGuess.feature.chat;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.GamePhase;
import com.copyleft.DrawGuess.feature.game.GameRoomLockFacade;
import com.copyleft.DrawGuess.feature.game.GuessService;
import com.copyleft.DrawGuess.feature.game.LockResult;
import com.copyleft.DrawGuess.feature.presence.PresenceBinding;
import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 채팅. 그림 단계에서 출제자가 아닌 플레이어의 채팅은 추측으로 판정한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final PresenceTracker presenceTracker;
    private final GuessService guessService;
    private final ChatResponseSender chatResponseSender;

    public void processChat(String sessionId, String message) {
        if (!StringUtils.hasText(message)) {
            chatResponseSender.sendError(sessionId, ErrorCode.CHAT_EMPTY);
            return;
        }

        Optional<PresenceBinding> bindingOpt = presenceTracker.findBinding(sessionId);
        if (bindingOpt.isEmpty()) {
            chatResponseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }
        PresenceBinding binding = bindingOpt.get();

        try {
            LockResult<Void> result = lockFacade.execute(binding.roomCode(), () -> {
                Room room = roomRepository.findByCode(binding.roomCode()).orElse(null);
                if (room == null) {
                    chatResponseSender.sendError(sessionId, ErrorCode.ROOM_NOT_FOUND);
                    return;
                }

                Player sender = room.findUser(binding.userId()).orElse(null);
                if (sender == null) {
                    chatResponseSender.sendError(sessionId, ErrorCode.USER_NOT_IN_ROOM);
                    return;
                }

                if (room.isGameStarted() && room.getGamePhase() == GamePhase.DRAWING) {
                    if (room.isDrawer(sender.getId())) {
                        chatResponseSender.sendError(sessionId, ErrorCode.CHAT_BLOCKED_FOR_DRAWER);
                        return;
                    }
                    guessService.applyGuess(room, sender.getId(), message, true);
                    return;
                }

                chatResponseSender.broadcastChat(room.getRoomCode(), sender, message);
                log.debug("채팅 전송: room={}, sender={}", room.getRoomCode(), sender.getNickname());
            });

            if (result.isLockFailed()) {
                chatResponseSender.sendError(sessionId, ErrorCode.SERVER_ERROR);
            }
        } catch (BackendUnavailableException e) {
            log.error("채팅 처리 실패: room={}, session={}", binding.roomCode(), sessionId, e);
            chatResponseSender.sendError(sessionId, ErrorCode.SERVER_ERROR);
        }
    }
}

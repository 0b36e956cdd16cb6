package com.copyleft.DrawGuess.feature.room;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.feature.game.GameRoomLockFacade;
import com.copyleft.DrawGuess.feature.game.LockResult;
import com.copyleft.DrawGuess.feature.game.RoundTimerRegistry;
import com.copyleft.DrawGuess.feature.game.dto.RoomSnapshot;
import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.copyleft.DrawGuess.feature.room.dto.RoomResponses;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.global.exception.RoomApiException;
import com.copyleft.DrawGuess.global.util.RandomUtil;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 방 생성/조회/입장/삭제 (HTTP). 실시간 연결은 이후 join-room 액션으로 묶인다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private static final int MAX_CODE_ATTEMPTS = 5;

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final RoundTimerRegistry roundTimerRegistry;
    private final PresenceTracker presenceTracker;
    private final GameProperties gameProperties;

    public RoomResponses.Detail getRoom(String roomCode) {
        Room room = roomRepository.findByCode(roomCode)
                .orElseThrow(RoomApiException::notFound);

        return RoomResponses.Detail.builder()
                .roomCode(roomCode)
                .room(RoomSnapshot.from(room))
                .build();
    }

    public RoomResponses.Created createRoom(String nickname) {
        requireNickname(nickname);

        String roomCode = generateUniqueCode();
        String userId = RandomUtil.generateUserId();

        Room room = Room.create(roomCode, Player.createHost(userId, nickname));
        roomRepository.save(room);

        log.info("방 생성: room={}, host={}", roomCode, nickname);

        return RoomResponses.Created.builder()
                .roomCode(roomCode)
                .userId(userId)
                .joinUrl("/room/" + roomCode)
                .build();
    }

    public RoomResponses.Joined joinRoom(String roomCode, String nickname) {
        requireNickname(nickname);

        LockResult<RoomResponses.Joined> result = lockFacade.execute(roomCode, () -> {
            Room room = roomRepository.findByCode(roomCode)
                    .orElseThrow(RoomApiException::notFound);

            if (room.isGameStarted()) {
                throw RoomApiException.badRequest("Game already in progress");
            }
            if (room.hasNickname(nickname)) {
                throw RoomApiException.badRequest("Nickname already taken in this room");
            }
            // 대기 중인 방의 maxPlayers는 직전 게임 설정일 수 있으므로 기본 정원 기준
            if (room.getUserCount() >= gameProperties.defaultMaxPlayers()) {
                throw RoomApiException.badRequest("Room is full");
            }

            String userId = RandomUtil.generateUserId();
            room.addUser(Player.createGuest(userId, nickname));
            roomRepository.save(room);

            log.info("방 입장: room={}, user={}", roomCode, nickname);

            return RoomResponses.Joined.builder()
                    .roomCode(roomCode)
                    .userId(userId)
                    .room(RoomSnapshot.from(room))
                    .build();
        });

        if (!result.isSuccess()) {
            throw new BackendUnavailableException("Room lock unavailable: " + roomCode, null);
        }
        return result.getData();
    }

    public String deleteRoom(String roomCode) {
        LockResult<Boolean> result = lockFacade.execute(roomCode, () -> {
            if (roomRepository.findByCode(roomCode).isEmpty()) {
                throw RoomApiException.notFound();
            }

            roundTimerRegistry.cancel(roomCode);
            roomRepository.delete(roomCode);
            presenceTracker.clearRoom(roomCode);
            return Boolean.TRUE;
        });

        if (!result.isSuccess()) {
            throw new BackendUnavailableException("Room lock unavailable: " + roomCode, null);
        }

        log.info("방 삭제: room={}", roomCode);
        return "Room " + roomCode + " deleted successfully";
    }

    private void requireNickname(String nickname) {
        if (!StringUtils.hasText(nickname)) {
            throw RoomApiException.badRequest("Nickname is required");
        }
    }

    private String generateUniqueCode() {
        for (int i = 0; i < MAX_CODE_ATTEMPTS; i++) {
            String code = RandomUtil.generateRoomCode();
            if (roomRepository.findByCode(code).isEmpty()) {
                return code;
            }
            log.warn("방 코드 충돌, 재생성 ({}/{}): {}", i + 1, MAX_CODE_ATTEMPTS, code);
        }
        throw new BackendUnavailableException("Could not allocate a room code", null);
    }
}

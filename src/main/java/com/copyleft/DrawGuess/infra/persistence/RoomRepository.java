package com.copyleft.DrawGuess.infra.persistence;

import com.copyleft.DrawGuess.config.GameProperties;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.global.constant.RedisKey;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Room 캐시. 매 저장마다 TTL 을 다시 설정한다 (생성 시점이 아니라 마지막 쓰기 기준).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RoomRepository {

    private final RedisTemplate<String, Room> roomRedisTemplate;
    private final GameProperties gameProperties;

    public Optional<Room> findByCode(String roomCode) {
        String key = RedisKey.ROOM.makeKey(roomCode);

        try {
            return Optional.ofNullable(roomRedisTemplate.opsForValue().get(key));
        } catch (DataAccessException | SerializationException e) {
            log.error("방 조회 실패: key={}", key, e);
            throw new BackendUnavailableException("Failed to read room " + roomCode, e);
        }
    }

    public void save(Room room) {
        String key = RedisKey.ROOM.makeKey(room.getRoomCode());

        try {
            roomRedisTemplate.opsForValue().set(key, room, Duration.ofSeconds(gameProperties.roomTtlSeconds()));
        } catch (DataAccessException | SerializationException e) {
            log.error("방 저장 실패: key={}", key, e);
            throw new BackendUnavailableException("Failed to write room " + room.getRoomCode(), e);
        }
    }

    public boolean delete(String roomCode) {
        String key = RedisKey.ROOM.makeKey(roomCode);

        try {
            return Boolean.TRUE.equals(roomRedisTemplate.delete(key));
        } catch (DataAccessException e) {
            log.error("방 삭제 실패: key={}", key, e);
            throw new BackendUnavailableException("Failed to delete room " + roomCode, e);
        }
    }
}

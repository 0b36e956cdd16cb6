package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.global.constant.RedisKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 방 단위 분산 락. 같은 방에 대한 모든 읽기-수정-쓰기는 이 락 안에서 한 번에 하나씩만 실행된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameRoomLockFacade {

    private final RedissonClient redissonClient;

    private static final long WAIT_TIME = 2L;        // 락 대기 최대 시간
    private static final long LEASE_TIME = 5L;       // 락 점유 최대 시간
    private static final int MAX_RETRY = 3;          // 최대 3번 재시도
    private static final long RETRY_DELAY_MS = 300L; // 재시도 사이 0.3초 휴식

    public LockResult<Void> execute(String roomCode, Runnable action) {
        return executeInternal(roomCode, () -> {
            action.run();
            return null;
        });
    }

    public <T> LockResult<T> execute(String roomCode, Supplier<T> action) {
        return executeInternal(roomCode, action);
    }

    private <T> LockResult<T> executeInternal(String roomCode, Supplier<T> action) {
        RLock lock = redissonClient.getLock(RedisKey.ROOM_LOCK.makeKey(roomCode));

        for (int i = 0; i < MAX_RETRY; i++) {
            boolean available;
            try {
                available = lock.tryLock(WAIT_TIME, LEASE_TIME, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                log.error("락 인터럽트 발생: room={}", roomCode, e);
                Thread.currentThread().interrupt();
                return LockResult.lockFailed();
            } catch (RedisException e) {
                log.error("락 서버 오류: room={}", roomCode, e);
                return LockResult.lockFailed();
            }

            if (available) {
                try {
                    T result = action.get();
                    return (result == null) ? LockResult.skipped() : LockResult.success(result);
                } finally {
                    unlockQuietly(lock, roomCode);
                }
            }

            log.warn("락 획득 실패, 재시도 대기중 ({}/{}): room={}", i + 1, MAX_RETRY, roomCode);
            try {
                Thread.sleep(RETRY_DELAY_MS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return LockResult.lockFailed();
            }
        }

        log.error("락 획득 최종 실패 (Timeout): room={}", roomCode);
        return LockResult.lockFailed();
    }

    private void unlockQuietly(RLock lock, String roomCode) {
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        } catch (RedisException e) {
            // lease 만료로 자동 해제된다
            log.warn("락 해제 실패: room={}, msg={}", roomCode, e.getMessage());
        }
    }
}

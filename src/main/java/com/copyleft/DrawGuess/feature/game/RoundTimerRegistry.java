package com.copyleft.DrawGuess.feature.game;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 방마다 최대 하나의 라운드 타이머. 새로 예약하면 이전 타이머는 취소된다.
 * 취소된 타이머가 이미 실행 중일 수 있으므로, 콜백 쪽에서 라운드 번호로 한 번 더 검증해야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoundTimerRegistry {

    private final TaskScheduler taskScheduler;

    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public void arm(String roomCode, Duration delay, Runnable task) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, Instant.now().plus(delay));

        ScheduledFuture<?> previous = (future != null)
                ? timers.put(roomCode, future)
                : timers.remove(roomCode);
        cancelFuture(previous);

        log.debug("라운드 타이머 예약: room={}, delay={}ms", roomCode, delay.toMillis());
    }

    public void cancel(String roomCode) {
        ScheduledFuture<?> previous = timers.remove(roomCode);
        if (previous != null) {
            cancelFuture(previous);
            log.debug("라운드 타이머 취소: room={}", roomCode);
        }
    }

    private void cancelFuture(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}

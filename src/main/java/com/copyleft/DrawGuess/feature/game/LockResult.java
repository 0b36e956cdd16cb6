package com.copyleft.DrawGuess.feature.game;

import lombok.Getter;

@Getter
public class LockResult<T> {
    private final T data;
    private final Status status;

    public enum Status {
        SUCCESS,            // 성공
        LOCK_FAILED,        // 락 획득 실패 (Redis 장애 포함)
        BUSINESS_SKIPPED    // 방 없음, 가드 실패 등으로 결과 없음
    }

    private LockResult(T data, Status status) {
        this.data = data;
        this.status = status;
    }

    public static <T> LockResult<T> success(T data) {
        return new LockResult<>(data, Status.SUCCESS);
    }

    public static <T> LockResult<T> lockFailed() {
        return new LockResult<>(null, Status.LOCK_FAILED);
    }

    public static <T> LockResult<T> skipped() {
        return new LockResult<>(null, Status.BUSINESS_SKIPPED);
    }

    public boolean isLockFailed() { return status == Status.LOCK_FAILED; }
    public boolean isSkipped() { return status == Status.BUSINESS_SKIPPED; }
    public boolean isSuccess() { return status == Status.SUCCESS; }
}

package com.copyleft.DrawGuess.global.exception;

/**
 * Redis 등 외부 저장소 장애. 진행 중인 액션은 중단되고 요청자에게 Server error 가 전달된다.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

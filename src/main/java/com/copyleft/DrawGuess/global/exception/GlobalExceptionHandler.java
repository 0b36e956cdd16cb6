package com.copyleft.DrawGuess.global.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // 400, 404 등 방 API 오류
    @ExceptionHandler(RoomApiException.class)
    public ResponseEntity<Map<String, String>> handleRoomApi(RoomApiException e) {
        return ResponseEntity
                .status(e.getStatus())
                .body(Map.of("error", e.getMessage()));
    }

    // 서버 내부 오류 (500)
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e) {
        log.error("REST 요청 처리 중 오류: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Server error"));
    }
}

package com.copyleft.DrawGuess.global.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class RoomApiException extends RuntimeException {

    private final HttpStatus status;

    public RoomApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public static RoomApiException badRequest(String message) {
        return new RoomApiException(HttpStatus.BAD_REQUEST, message);
    }

    public static RoomApiException notFound() {
        return new RoomApiException(HttpStatus.NOT_FOUND, "Room not found");
    }
}

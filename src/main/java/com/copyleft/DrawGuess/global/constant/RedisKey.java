package com.copyleft.DrawGuess.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum RedisKey {

    ROOM("room:"),           // String (room:B3FK9Q) - Room JSON
    ROOM_LOCK("room-lock:"); // Redisson RLock

    private final String prefix;

    public String makeKey(String identifier) {
        return this.prefix + identifier;
    }
}

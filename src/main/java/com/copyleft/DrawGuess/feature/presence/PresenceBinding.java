package com.copyleft.DrawGuess.feature.presence;

/**
 * 연결 하나가 대표하는 (방, 유저).
 */
public record PresenceBinding(String roomCode, String userId) {
}

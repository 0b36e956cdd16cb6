package com.copyleft.DrawGuess.global.util;

import java.security.SecureRandom;

public class RandomUtil {

    private static final SecureRandom random = new SecureRandom();
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final String URL_SAFE = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789_-";

    private RandomUtil() {
    }

    /**
     * 대문자+숫자 6자리 코드 생성 (RoomCode용)
     */
    public static String generateRoomCode() {
        return randomString(ALPHANUMERIC, 6);
    }

    /**
     * URL-safe 10자리 ID 생성 (UserId용)
     */
    public static String generateUserId() {
        return randomString(URL_SAFE, 10);
    }

    public static int nextIndex(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("Bound must be positive");
        }
        return random.nextInt(bound);
    }

    private static String randomString(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            int index = random.nextInt(alphabet.length());
            sb.append(alphabet.charAt(index));
        }
        return sb.toString();
    }
}

package com.copyleft.DrawGuess.domain.type;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@Getter
public enum WordDifficulty {

    EASY(10, Arrays.asList(
            // 사물
            "apple", "book", "car", "dog", "eye", "fish", "gun", "hat", "ice", "jam",
            "key", "lamp", "moon", "nose", "owl", "pen", "queen", "rain", "sun", "tree",
            "umbrella", "van", "water", "box", "yard", "zebra", "ball", "cat", "door", "egg",
            "fire", "glass", "hand", "island", "juice", "kite", "leaf", "mouse", "nail", "ocean",
            "pizza", "rabbit", "star", "table", "up", "violin", "window", "x-ray", "yellow", "zoo",
            // 신체
            "head", "arm", "leg", "foot", "hair", "ear", "mouth", "tooth", "finger", "knee",
            // 음식
            "bread", "cheese", "milk", "cake", "cookie", "banana", "orange", "grape", "chicken", "rice",
            // 동물
            "bird", "bear", "lion", "tiger", "elephant", "horse", "cow", "pig", "sheep", "duck"
    )),

    MEDIUM(15, Arrays.asList(
            // 동작
            "running", "jumping", "swimming", "dancing", "singing", "cooking", "reading", "writing", "sleeping", "laughing",
            "crying", "walking", "flying", "climbing", "driving", "painting", "drawing", "thinking", "dreaming", "working",
            // 사물
            "telescope", "computer", "bicycle", "airplane", "helicopter", "submarine", "castle", "bridge", "lighthouse", "windmill",
            "robot", "dinosaur", "skeleton", "volcano", "rainbow", "tornado", "spaceship", "treasure", "crown", "sword",
            // 장소, 개념
            "birthday", "vacation", "school", "hospital", "restaurant", "library", "museum", "garden", "forest", "beach",
            "mountain", "desert", "jungle", "city", "village", "farm", "park", "circus", "theater", "concert",
            // 직업
            "doctor", "teacher", "police", "firefighter", "chef", "artist", "musician", "dancer", "pilot", "sailor"
    )),

    HARD(25, Arrays.asList(
            // 추상 개념
            "democracy", "philosophy", "psychology", "evolution", "gravity", "electricity", "magnetism", "photosynthesis", "ecosystem", "civilization",
            "architecture", "archaeology", "astronomy", "meteorology", "geography", "biography", "mythology", "technology", "laboratory", "observatory",
            // 감정
            "nostalgia", "melancholy", "euphoria", "anxiety", "serenity", "confusion", "determination", "curiosity", "jealousy", "confidence",
            // 활동
            "meditation", "negotiation", "investigation", "celebration", "communication", "transportation", "organization", "imagination", "inspiration", "innovation",
            // 복합 개념
            "friendship", "leadership", "championship", "relationship", "partnership", "scholarship", "citizenship", "ownership", "membership", "apprenticeship"
    )),

    UNKNOWN(10, Collections.emptyList());

    private final int points;
    private final List<String> words;

    WordDifficulty(int points, List<String> words) {
        this.points = points;
        this.words = Collections.unmodifiableList(words);
    }

    public static WordDifficulty of(String word) {
        if (word == null) return UNKNOWN;

        for (WordDifficulty difficulty : values()) {
            if (difficulty.words.contains(word)) {
                return difficulty;
            }
        }
        return UNKNOWN;
    }
}

package com.copyleft.DrawGuess.feature.word;

import com.copyleft.DrawGuess.domain.type.WordDifficulty;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 제시어 풀. 읽기 전용이므로 모든 방이 동기화 없이 공유한다.
 */
@Component
public class WordBank {

    private static final int MIXED_EASY = 20;
    private static final int MIXED_MEDIUM = 15;
    private static final int MIXED_HARD = 5;

    private final SecureRandom random = new SecureRandom();

    private final List<String> mixedPool;
    private final List<String> allWords;

    public WordBank() {
        List<String> mixed = new ArrayList<>();
        mixed.addAll(WordDifficulty.EASY.getWords().subList(0, MIXED_EASY));
        mixed.addAll(WordDifficulty.MEDIUM.getWords().subList(0, MIXED_MEDIUM));
        mixed.addAll(WordDifficulty.HARD.getWords().subList(0, MIXED_HARD));
        this.mixedPool = Collections.unmodifiableList(mixed);

        List<String> all = new ArrayList<>();
        all.addAll(WordDifficulty.EASY.getWords());
        all.addAll(WordDifficulty.MEDIUM.getWords());
        all.addAll(WordDifficulty.HARD.getWords());
        this.allWords = Collections.unmodifiableList(all);
    }

    /**
     * 출제용 혼합 난이도 단어 (쉬움 20 + 보통 15 + 어려움 5 개 중에서 추첨).
     */
    public List<String> randomWords(int count) {
        return pick(mixedPool, count);
    }

    public List<String> randomWords(int count, WordDifficulty difficulty) {
        if (difficulty == null || difficulty == WordDifficulty.UNKNOWN) {
            return pick(allWords, count);
        }
        return pick(difficulty.getWords(), count);
    }

    public WordDifficulty difficultyOf(String word) {
        return WordDifficulty.of(word);
    }

    public int pointsFor(String word) {
        return WordDifficulty.of(word).getPoints();
    }

    List<String> getMixedPool() {
        return mixedPool;
    }

    private List<String> pick(List<String> pool, int count) {
        List<String> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, Math.max(0, Math.min(count, shuffled.size()))));
    }
}

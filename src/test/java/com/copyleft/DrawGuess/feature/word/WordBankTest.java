package com.copyleft.DrawGuess.feature.word;

import com.copyleft.DrawGuess.domain.type.WordDifficulty;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordBankTest {

    private final WordBank wordBank = new WordBank();

    @Test
    @DisplayName("혼합 풀은 쉬움 앞 20개, 보통 앞 15개, 어려움 앞 5개로 구성된다")
    void mixedPool_Composition() {
        List<String> pool = wordBank.getMixedPool();

        assertEquals(40, pool.size());
        assertEquals(WordDifficulty.EASY.getWords().subList(0, 20), pool.subList(0, 20));
        assertEquals(WordDifficulty.MEDIUM.getWords().subList(0, 15), pool.subList(20, 35));
        assertEquals(WordDifficulty.HARD.getWords().subList(0, 5), pool.subList(35, 40));
    }

    @Test
    @DisplayName("제시어 3개는 서로 다르고 모두 혼합 풀 안에서 나온다")
    void randomWords_DistinctFromMixedPool() {
        for (int i = 0; i < 50; i++) {
            List<String> words = wordBank.randomWords(3);

            assertEquals(3, words.size());
            assertEquals(3, new HashSet<>(words).size());
            assertTrue(wordBank.getMixedPool().containsAll(words));
        }
    }

    @Test
    @DisplayName("난이도를 지정하면 해당 난이도 풀에서만 뽑는다")
    void randomWords_ByDifficulty() {
        List<String> words = wordBank.randomWords(5, WordDifficulty.HARD);

        assertEquals(5, words.size());
        assertTrue(WordDifficulty.HARD.getWords().containsAll(words));
    }

    @Test
    @DisplayName("요청 개수가 풀보다 크면 풀 크기만큼만 돌려준다")
    void randomWords_TruncatesToPool() {
        assertEquals(40, wordBank.randomWords(100).size());
        assertTrue(wordBank.randomWords(0).isEmpty());
    }

    @Test
    @DisplayName("점수는 쉬움 10, 보통 15, 어려움 25, 목록에 없는 단어 10")
    void pointsFor_ByTier() {
        assertEquals(10, wordBank.pointsFor("apple"));
        assertEquals(15, wordBank.pointsFor("castle"));
        assertEquals(25, wordBank.pointsFor("democracy"));
        assertEquals(10, wordBank.pointsFor("hot dog"));

        assertEquals(WordDifficulty.UNKNOWN, wordBank.difficultyOf("hot dog"));
        assertEquals(WordDifficulty.MEDIUM, wordBank.difficultyOf("castle"));
    }
}

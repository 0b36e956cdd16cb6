package com.copyleft.DrawGuess.feature.presence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PresenceTrackerTest {

    private final PresenceTracker tracker = new PresenceTracker();

    @Test
    @DisplayName("바인딩 후 세션, 유저, 방 그룹으로 각각 조회된다")
    void bind() {
        // when
        Optional<String> replaced = tracker.bind("s1", "ROOM01", "A");
        tracker.bind("s2", "ROOM01", "B");

        // then
        assertTrue(replaced.isEmpty());
        assertEquals(new PresenceBinding("ROOM01", "A"), tracker.findBinding("s1").orElseThrow());
        assertEquals("s2", tracker.findSession("ROOM01", "B").orElseThrow());
        assertEquals(Set.of("s1", "s2"), tracker.sessionsInRoom("ROOM01"));
    }

    @Test
    @DisplayName("같은 유저가 다시 연결하면 이전 연결의 바인딩이 사라진다")
    void bind_ReplacesOlderConnection() {
        // given
        tracker.bind("old", "ROOM01", "A");

        // when
        Optional<String> replaced = tracker.bind("new", "ROOM01", "A");

        // then
        assertEquals("old", replaced.orElseThrow());
        assertTrue(tracker.findBinding("old").isEmpty());
        assertEquals("new", tracker.findSession("ROOM01", "A").orElseThrow());
        assertEquals(Set.of("new"), tracker.sessionsInRoom("ROOM01"));

        // 대체된 연결이 나중에 끊겨도 새 연결에는 영향 없음
        assertTrue(tracker.unbind("old").isEmpty());
        assertEquals("new", tracker.findSession("ROOM01", "A").orElseThrow());
    }

    @Test
    @DisplayName("한 세션이 다른 방에 다시 묶이면 이전 방 그룹에서 빠진다")
    void bind_MovesBetweenRooms() {
        // given
        tracker.bind("s1", "ROOM01", "A");

        // when
        tracker.bind("s1", "ROOM02", "A");

        // then
        assertTrue(tracker.sessionsInRoom("ROOM01").isEmpty());
        assertTrue(tracker.findSession("ROOM01", "A").isEmpty());
        assertEquals(Set.of("s1"), tracker.sessionsInRoom("ROOM02"));
    }

    @Test
    @DisplayName("unbind 는 바인딩을 돌려주고 모든 매핑에서 제거한다")
    void unbind() {
        // given
        tracker.bind("s1", "ROOM01", "A");

        // when
        Optional<PresenceBinding> removed = tracker.unbind("s1");

        // then
        assertEquals("A", removed.orElseThrow().userId());
        assertTrue(tracker.findBinding("s1").isEmpty());
        assertTrue(tracker.findSession("ROOM01", "A").isEmpty());
        assertTrue(tracker.sessionsInRoom("ROOM01").isEmpty());
        assertTrue(tracker.unbind("s1").isEmpty());
    }

    @Test
    @DisplayName("방 정리 시 그 방의 모든 연결 바인딩이 사라진다")
    void clearRoom() {
        // given
        tracker.bind("s1", "ROOM01", "A");
        tracker.bind("s2", "ROOM01", "B");
        tracker.bind("s3", "ROOM02", "C");

        // when
        tracker.clearRoom("ROOM01");

        // then
        assertTrue(tracker.findBinding("s1").isEmpty());
        assertTrue(tracker.findBinding("s2").isEmpty());
        assertTrue(tracker.sessionsInRoom("ROOM01").isEmpty());
        assertEquals(Set.of("s3"), tracker.sessionsInRoom("ROOM02"));
    }

    @Test
    @DisplayName("null 입력은 빈 결과")
    void nullLookups() {
        assertTrue(tracker.findBinding(null).isEmpty());
        assertTrue(tracker.findSession(null, "A").isEmpty());
        assertTrue(tracker.sessionsInRoom("NOPE").isEmpty());
    }
}

package com.copyleft.DrawGuess.feature.presence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 세션 ↔ (방, 유저) 양방향 매핑과 방별 브로드캐스트 그룹.
 * 복합 갱신은 synchronized 로 묶고, 조회는 락 없이 ConcurrentHashMap 에서 읽는다.
 */
@Slf4j
@Component
public class PresenceTracker {

    private final Map<String, PresenceBinding> bindingsBySession = new ConcurrentHashMap<>();
    private final Map<PresenceBinding, String> sessionsByUser = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> roomGroups = new ConcurrentHashMap<>();

    /**
     * 세션을 (방, 유저)에 묶는다. 같은 유저의 이전 연결이 있으면 그 연결의 바인딩을 대체한다.
     *
     * @return 대체된 이전 세션 ID
     */
    public synchronized Optional<String> bind(String sessionId, String roomCode, String userId) {
        // 같은 세션이 다른 방에 묶여 있었다면 먼저 풀어준다
        removeSessionInternal(sessionId);

        PresenceBinding binding = new PresenceBinding(roomCode, userId);
        String previous = sessionsByUser.put(binding, sessionId);
        if (previous != null && !previous.equals(sessionId)) {
            bindingsBySession.remove(previous);
            Set<String> group = roomGroups.get(roomCode);
            if (group != null) {
                group.remove(previous);
            }
            log.info("재접속으로 이전 연결 대체: room={}, user={}, old={}, new={}", roomCode, userId, previous, sessionId);
        }

        bindingsBySession.put(sessionId, binding);
        roomGroups.computeIfAbsent(roomCode, k -> ConcurrentHashMap.newKeySet()).add(sessionId);

        return (previous != null && !previous.equals(sessionId)) ? Optional.of(previous) : Optional.empty();
    }

    public synchronized Optional<PresenceBinding> unbind(String sessionId) {
        return Optional.ofNullable(removeSessionInternal(sessionId));
    }

    public Optional<PresenceBinding> findBinding(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(bindingsBySession.get(sessionId));
    }

    /**
     * 개인 이벤트(제시어 후보, 정답 단어) 전달용. 연결이 없으면 빈 값.
     */
    public Optional<String> findSession(String roomCode, String userId) {
        if (roomCode == null || userId == null) return Optional.empty();
        return Optional.ofNullable(sessionsByUser.get(new PresenceBinding(roomCode, userId)));
    }

    public Set<String> sessionsInRoom(String roomCode) {
        Set<String> group = roomGroups.get(roomCode);
        return group == null ? Collections.emptySet() : Set.copyOf(group);
    }

    public synchronized void clearRoom(String roomCode) {
        Set<String> group = roomGroups.remove(roomCode);
        if (group == null) return;

        for (String sessionId : group) {
            PresenceBinding binding = bindingsBySession.remove(sessionId);
            if (binding != null) {
                sessionsByUser.remove(binding, sessionId);
            }
        }
    }

    private PresenceBinding removeSessionInternal(String sessionId) {
        PresenceBinding binding = bindingsBySession.remove(sessionId);
        if (binding == null) {
            return null;
        }

        sessionsByUser.remove(binding, sessionId);

        Set<String> group = roomGroups.get(binding.roomCode());
        if (group != null) {
            group.remove(sessionId);
            if (group.isEmpty()) {
                roomGroups.remove(binding.roomCode(), group);
            }
        }
        return binding;
    }
}

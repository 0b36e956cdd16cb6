package com.copyleft.DrawGuess.infra.messaging;

import com.copyleft.DrawGuess.config.EventBusProperties;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.GuessOutcome;
import com.copyleft.DrawGuess.feature.game.GuessService;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.infra.messaging.dto.GameServiceRequest;
import com.copyleft.DrawGuess.infra.messaging.dto.GameServiceResponse;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 다른 서비스(채팅 등)의 요청 처리. 요청 토픽을 구독하고 replyTo 토픽으로 응답한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "game.event-bus", name = "enabled", havingValue = "true")
public class GameRequestListener {

    static final String CHECK_GUESS = "check-guess";
    static final String GET_CURRENT_DRAWER = "get-current-drawer";

    private final RedissonClient redissonClient;
    private final EventBusProperties eventBusProperties;
    private final ObjectMapper objectMapper;
    private final GuessService guessService;
    private final RoomRepository roomRepository;

    private Integer listenerId;

    @PostConstruct
    public void init() {
        RTopic topic = redissonClient.getTopic(eventBusProperties.requestTopic(), StringCodec.INSTANCE);

        listenerId = topic.addListener(String.class, (channel, body) -> {
            try {
                onRequest(body);
            } catch (Exception e) {
                log.error("서비스 요청 처리 중 오류: body={}", body, e);
            }
        });
        log.info("서비스 요청 구독 시작: Topic={}", eventBusProperties.requestTopic());
    }

    @PreDestroy
    public void destroy() {
        if (listenerId != null) {
            redissonClient.getTopic(eventBusProperties.requestTopic(), StringCodec.INSTANCE).removeListener(listenerId);
        }
    }

    void onRequest(String body) throws JsonProcessingException {
        GameServiceRequest request = objectMapper.readValue(body, GameServiceRequest.class);
        Object data = handle(request.getAction(), request.getData());

        if (request.getReplyTo() == null) {
            return;
        }

        String reply = objectMapper.writeValueAsString(new GameServiceResponse(request.getId(), data));
        redissonClient.getTopic(request.getReplyTo(), StringCodec.INSTANCE).publish(reply);
    }

    Object handle(String action, JsonNode data) {
        if (CHECK_GUESS.equals(action)) {
            return checkGuess(data);
        }
        if (GET_CURRENT_DRAWER.equals(action)) {
            return getCurrentDrawer(data);
        }
        log.warn("알 수 없는 서비스 요청: {}", action);
        return Map.of("error", "Unknown action");
    }

    private Map<String, Object> checkGuess(JsonNode data) {
        String roomCode = text(data, "roomCode");
        String userId = text(data, "userId");
        String guess = text(data, "guess");

        Map<String, Object> result = new LinkedHashMap<>();
        if (roomCode == null || userId == null || guess == null) {
            result.put("isGameActive", false);
            result.put("isCorrect", false);
            return result;
        }

        GuessOutcome outcome;
        try {
            outcome = guessService.submitGuess(roomCode, userId, guess, false);
        } catch (BackendUnavailableException e) {
            log.error("check-guess 처리 실패: room={}", roomCode, e);
            outcome = GuessOutcome.NOT_ACTIVE;
        }

        result.put("isGameActive", outcome.isGameActive());
        result.put("isCorrect", outcome == GuessOutcome.CORRECT);
        return result;
    }

    private Map<String, Object> getCurrentDrawer(JsonNode data) {
        String roomCode = text(data, "roomCode");

        Map<String, Object> result = new LinkedHashMap<>();
        Room room = null;
        try {
            room = (roomCode == null) ? null : roomRepository.findByCode(roomCode).orElse(null);
        } catch (BackendUnavailableException e) {
            log.error("get-current-drawer 처리 실패: room={}", roomCode, e);
        }

        if (room == null) {
            result.put("currentDrawer", null);
            result.put("gamePhase", "unknown");
            return result;
        }

        result.put("currentDrawer", room.getCurrentDrawer());
        result.put("gamePhase", room.getGamePhase().getCode());
        result.put("gameStarted", room.isGameStarted());
        return result;
    }

    private String text(JsonNode data, String field) {
        return (data != null && data.hasNonNull(field)) ? data.get(field).asText() : null;
    }
}

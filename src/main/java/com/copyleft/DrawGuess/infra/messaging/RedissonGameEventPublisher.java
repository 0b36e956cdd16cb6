package com.copyleft.DrawGuess.infra.messaging;

import com.copyleft.DrawGuess.config.EventBusProperties;
import com.copyleft.DrawGuess.infra.messaging.dto.GameEventMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Redis Pub/Sub(RTopic) 으로 게임 이벤트 발행. 토픽은 game.event.{type}, 본문은 JSON 문자열.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "game.event-bus", name = "enabled", havingValue = "true")
public class RedissonGameEventPublisher implements GameEventPublisher {

    private final RedissonClient redissonClient;
    private final EventBusProperties eventBusProperties;
    private final ObjectMapper objectMapper;

    @Override
    public void publish(String type, String roomCode, Object data) {
        GameEventMessage message = GameEventMessage.builder()
                .type(type)
                .roomCode(roomCode)
                .data(data)
                .timestamp(System.currentTimeMillis())
                .build();

        String topicName = eventBusProperties.eventTopic(type);
        try {
            String body = objectMapper.writeValueAsString(message);
            RTopic topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);

            topic.publishAsync(body).whenComplete((receivers, e) -> {
                if (e != null) {
                    log.error("게임 이벤트 발행 실패: topic={}, room={}", topicName, roomCode, e);
                } else {
                    log.debug("게임 이벤트 발행: topic={}, room={}, receivers={}", topicName, roomCode, receivers);
                }
            });
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("게임 이벤트 발행 실패: topic={}, room={}", topicName, roomCode, e);
        }
    }
}

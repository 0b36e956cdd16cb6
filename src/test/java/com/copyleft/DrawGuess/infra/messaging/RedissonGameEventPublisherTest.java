package com.copyleft.DrawGuess.infra.messaging;

import com.copyleft.DrawGuess.config.EventBusProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RFuture;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.client.RedisException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedissonGameEventPublisherTest {

    @Mock private RedissonClient redissonClient;
    @Mock private RTopic topic;
    @Mock private RFuture<Long> future;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedissonGameEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new RedissonGameEventPublisher(
                redissonClient, new EventBusProperties(true, "game.event.", "game.requests"), objectMapper);
    }

    @Test
    @DisplayName("game.event.{type} 토픽에 type, roomCode, data, timestamp 를 담아 발행한다")
    void publish() throws Exception {
        // given
        when(redissonClient.getTopic(eq("game.event.correct-guess"), any(StringCodec.class))).thenReturn(topic);
        when(topic.publishAsync(any())).thenReturn(future);

        // when
        publisher.publish("correct-guess", "ROOM01", Map.of("userId", "B", "points", 10));

        // then
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(topic).publishAsync(captor.capture());
        JsonNode body = objectMapper.readTree((String) captor.getValue());
        assertEquals("correct-guess", body.get("type").asText());
        assertEquals("ROOM01", body.get("roomCode").asText());
        assertEquals(10, body.get("data").get("points").asInt());
        assertTrue(body.get("timestamp").asLong() > 0);
    }

    @Test
    @DisplayName("발행 실패는 호출자에게 전파되지 않는다")
    void publish_Failure() {
        // given
        when(redissonClient.getTopic(eq("game.event.game-ended"), any(StringCodec.class)))
                .thenThrow(new RedisException("down"));

        // when & then
        assertDoesNotThrow(() -> publisher.publish("game-ended", "ROOM01", Map.of()));
    }
}

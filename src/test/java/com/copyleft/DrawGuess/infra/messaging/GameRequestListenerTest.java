package com.copyleft.DrawGuess.infra.messaging;

import com.copyleft.DrawGuess.config.EventBusProperties;
import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.type.GuessOutcome;
import com.copyleft.DrawGuess.domain.vo.GameSettings;
import com.copyleft.DrawGuess.feature.game.GuessService;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameRequestListenerTest {

    @Mock private RedissonClient redissonClient;
    @Mock private GuessService guessService;
    @Mock private RoomRepository roomRepository;
    @Mock private RTopic replyTopic;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GameRequestListener listener;

    @BeforeEach
    void setUp() {
        listener = new GameRequestListener(
                redissonClient,
                new EventBusProperties(true, "game.event.", "game.requests"),
                objectMapper,
                guessService,
                roomRepository);
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    @Test
    @DisplayName("check-guess: 정답이면 isCorrect=true, 오답은 채팅으로 다시 보내지 않는다")
    void checkGuess_Correct() throws Exception {
        // given
        when(guessService.submitGuess("ROOM01", "B", "cat", false)).thenReturn(GuessOutcome.CORRECT);

        // when
        Object result = listener.handle("check-guess", json("{\"roomCode\":\"ROOM01\",\"userId\":\"B\",\"guess\":\"cat\"}"));

        // then
        assertEquals(Map.of("isGameActive", true, "isCorrect", true), result);
    }

    @Test
    @DisplayName("check-guess: 게임이 진행 중이 아니면 isGameActive=false")
    void checkGuess_NotActive() throws Exception {
        // given
        when(guessService.submitGuess("ROOM01", "B", "cat", false)).thenReturn(GuessOutcome.NOT_ACTIVE);

        // when
        Object result = listener.handle("check-guess", json("{\"roomCode\":\"ROOM01\",\"userId\":\"B\",\"guess\":\"cat\"}"));

        // then
        assertEquals(Map.of("isGameActive", false, "isCorrect", false), result);
    }

    @Test
    @DisplayName("check-guess: 출제자의 추측은 진행 중이지만 정답 아님")
    void checkGuess_Drawer() throws Exception {
        // given
        when(guessService.submitGuess("ROOM01", "A", "cat", false)).thenReturn(GuessOutcome.DRAWER);

        // when
        Object result = listener.handle("check-guess", json("{\"roomCode\":\"ROOM01\",\"userId\":\"A\",\"guess\":\"cat\"}"));

        // then
        assertEquals(Map.of("isGameActive", true, "isCorrect", false), result);
    }

    @Test
    @DisplayName("check-guess: 필드가 빠졌거나 캐시 장애면 비활성으로 응답")
    void checkGuess_InvalidOrBackendDown() throws Exception {
        // given
        when(guessService.submitGuess("ROOM01", "B", "cat", false))
                .thenThrow(new BackendUnavailableException("redis down", null));

        // when
        Object missing = listener.handle("check-guess", json("{\"roomCode\":\"ROOM01\"}"));
        Object down = listener.handle("check-guess", json("{\"roomCode\":\"ROOM01\",\"userId\":\"B\",\"guess\":\"cat\"}"));

        // then
        assertEquals(Map.of("isGameActive", false, "isCorrect", false), missing);
        assertEquals(Map.of("isGameActive", false, "isCorrect", false), down);
    }

    @Test
    @DisplayName("get-current-drawer: 현재 출제자와 단계")
    @SuppressWarnings("unchecked")
    void getCurrentDrawer() throws Exception {
        // given
        Room room = Room.create("ROOM01", Player.createHost("A", "Amy"));
        room.addUser(Player.createGuest("B", "Ben"));
        room.startGame(new GameSettings(3, 10, 60), "B");
        when(roomRepository.findByCode("ROOM01")).thenReturn(Optional.of(room));

        // when
        Map<String, Object> result = (Map<String, Object>) listener.handle("get-current-drawer", json("{\"roomCode\":\"ROOM01\"}"));

        // then
        assertEquals("B", result.get("currentDrawer"));
        assertEquals("word-selection", result.get("gamePhase"));
        assertEquals(true, result.get("gameStarted"));
    }

    @Test
    @DisplayName("get-current-drawer: 없는 방은 unknown")
    @SuppressWarnings("unchecked")
    void getCurrentDrawer_NoRoom() throws Exception {
        // given
        when(roomRepository.findByCode("NOPE")).thenReturn(Optional.empty());

        // when
        Map<String, Object> result = (Map<String, Object>) listener.handle("get-current-drawer", json("{\"roomCode\":\"NOPE\"}"));

        // then
        assertTrue(result.containsKey("currentDrawer"));
        assertNull(result.get("currentDrawer"));
        assertEquals("unknown", result.get("gamePhase"));
    }

    @Test
    @DisplayName("알 수 없는 요청")
    void unknownAction() {
        assertEquals(Map.of("error", "Unknown action"), listener.handle("reset-everything", null));
    }

    @Test
    @DisplayName("응답은 요청 ID 와 함께 replyTo 토픽으로 발행된다")
    void onRequest_Replies() throws Exception {
        // given
        when(guessService.submitGuess("ROOM01", "B", "cat", false)).thenReturn(GuessOutcome.INCORRECT);
        when(redissonClient.getTopic(eq("chat.replies"), any(StringCodec.class))).thenReturn(replyTopic);

        String body = "{\"id\":\"req-1\",\"action\":\"check-guess\",\"replyTo\":\"chat.replies\","
                + "\"data\":{\"roomCode\":\"ROOM01\",\"userId\":\"B\",\"guess\":\"cat\"}}";

        // when
        listener.onRequest(body);

        // then
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(replyTopic).publish(captor.capture());
        JsonNode reply = objectMapper.readTree((String) captor.getValue());
        assertEquals("req-1", reply.get("requestId").asText());
        assertTrue(reply.get("data").get("isGameActive").asBoolean());
        assertFalse(reply.get("data").get("isCorrect").asBoolean());
    }

    @Test
    @DisplayName("replyTo 가 없으면 응답을 보내지 않는다")
    void onRequest_NoReplyTo() throws Exception {
        // given
        when(guessService.submitGuess(anyString(), anyString(), anyString(), eq(false))).thenReturn(GuessOutcome.CORRECT);

        // when
        listener.onRequest("{\"id\":\"req-2\",\"action\":\"check-guess\","
                + "\"data\":{\"roomCode\":\"ROOM01\",\"userId\":\"B\",\"guess\":\"cat\"}}");

        // then
        verifyNoInteractions(redissonClient);
    }
}

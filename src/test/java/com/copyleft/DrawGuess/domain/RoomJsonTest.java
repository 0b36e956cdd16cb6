package com.copyleft.DrawGuess.domain;

import com.copyleft.DrawGuess.domain.type.GamePhase;
import com.copyleft.DrawGuess.domain.vo.GameSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 캐시에 저장되는 Room JSON 형태. RedisConfig 와 같은 직렬화기를 사용한다.
 */
class RoomJsonTest {

    private ObjectMapper objectMapper;
    private Jackson2JsonRedisSerializer<Room> serializer;

    @BeforeEach
    void setUp() {
        objectMapper = Jackson2ObjectMapperBuilder.json().build();
        serializer = new Jackson2JsonRedisSerializer<>(objectMapper, Room.class);
    }

    private Room startedRoom() {
        Room room = Room.create("ROOM01", Player.createHost("A", "Amy"));
        room.addUser(Player.createGuest("B", "Ben"));
        room.startGame(new GameSettings(2, 8, 45), "B");
        room.offerWordOptions(List.of("cat", "castle", "astronaut"));
        return room;
    }

    @Test
    @DisplayName("Player 는 isHost 로, 단계는 소문자 코드로 저장되고 계산용 getter 는 빠진다")
    void serialize_Shape() throws Exception {
        // when
        JsonNode json = objectMapper.readTree(serializer.serialize(startedRoom()));

        // then
        JsonNode host = json.get("users").get(0);
        assertTrue(host.get("isHost").asBoolean());
        assertFalse(host.has("host"));
        assertFalse(json.get("users").get(1).get("isHost").asBoolean());

        assertEquals("word-selection", json.get("gamePhase").asText());
        assertEquals("B", json.get("currentDrawer").asText());
        assertEquals(3, json.get("wordOptions").size());

        assertFalse(json.has("userCount"));
        assertFalse(json.has("empty"));
        assertFalse(json.has("lastRound"));
        assertFalse(json.has("maskedWord"));
        assertFalse(json.has("nextDrawerId"));
    }

    @Test
    @DisplayName("저장한 JSON 을 다시 읽으면 유저, 출제자, 후보, 설정이 그대로 복원된다")
    void roundTrip() {
        // given
        Room original = startedRoom();
        original.findUser("A").orElseThrow().addScore(15);

        // when
        Room restored = serializer.deserialize(serializer.serialize(original));

        // then
        assertNotNull(restored);
        assertEquals("ROOM01", restored.getRoomCode());
        assertEquals(GamePhase.WORD_SELECTION, restored.getGamePhase());
        assertTrue(restored.isGameStarted());
        assertEquals("B", restored.getCurrentDrawer());
        assertEquals(List.of("cat", "castle", "astronaut"), restored.getWordOptions());
        assertEquals(2, restored.getRounds());
        assertEquals(8, restored.getMaxPlayers());
        assertEquals(45, restored.getRoundDuration());

        assertEquals(2, restored.getUserCount());
        Player host = restored.getUsers().get(0);
        assertEquals("A", host.getId());
        assertEquals("Amy", host.getNickname());
        assertTrue(host.isHost());
        assertEquals(15, host.getScore());
        assertFalse(restored.getUsers().get(1).isHost());
    }

    @Test
    @DisplayName("다른 서비스가 쓴 Room JSON(대문자 단계 이름 포함)도 읽을 수 있다")
    void deserialize_ExternalBlob() throws Exception {
        // given
        String blob = "{\"roomCode\":\"ROOM02\",\"users\":[{\"id\":\"X\",\"nickname\":\"Xia\",\"isHost\":true,"
                + "\"score\":0,\"joinedAt\":1}],\"gameStarted\":false,\"gamePhase\":\"waiting\","
                + "\"rounds\":3,\"currentRound\":0,\"maxPlayers\":10,\"roundDuration\":60,\"createdAt\":1}";

        // when
        Room room = objectMapper.readValue(blob, Room.class);
        Room legacy = objectMapper.readValue(blob.replace("\"waiting\"", "\"GAME_END\""), Room.class);

        // then
        assertEquals(GamePhase.WAITING, room.getGamePhase());
        assertTrue(room.isHostUser("X"));
        assertEquals(GamePhase.GAME_END, legacy.getGamePhase());
    }
}

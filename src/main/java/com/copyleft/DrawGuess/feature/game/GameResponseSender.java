package com.copyleft.DrawGuess.feature.game;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.vo.GameResult;
import com.copyleft.DrawGuess.domain.vo.GameSettings;
import com.copyleft.DrawGuess.feature.game.dto.GamePayloads;
import com.copyleft.DrawGuess.feature.game.dto.RoomSnapshot;
import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.constant.GameCode;
import com.copyleft.DrawGuess.global.constant.SocketEvent;
import com.copyleft.DrawGuess.infra.messaging.GameEventPublisher;
import com.copyleft.DrawGuess.infra.websocket.WebSocketSender;
import com.copyleft.DrawGuess.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class GameResponseSender {

    private final WebSocketSender webSocketSender;
    private final PresenceTracker presenceTracker;
    private final Optional<GameEventPublisher> eventPublisher;

    // 입장

    public void broadcastUserJoined(Room room, Player user) {
        GamePayloads.UserJoined data = GamePayloads.UserJoined.builder()
                .user(user)
                .users(List.copyOf(room.getUsers()))
                .build();

        broadcast(room, SocketEvent.USER_JOINED, GameCode.USER_JOINED.format(user.getNickname()), data);
    }

    public void sendRoomJoined(String sessionId, Room room) {
        GamePayloads.RoomJoined data = GamePayloads.RoomJoined.builder()
                .room(RoomSnapshot.from(room))
                .build();

        send(sessionId, SocketEvent.ROOM_JOINED, null, data);
    }

    public void broadcastUserLeft(Room room, Player user, boolean gameEnded) {
        String msg = gameEnded
                ? GameCode.USER_LEFT_GAME_ENDED.format(user.getNickname())
                : GameCode.USER_LEFT.format(user.getNickname());

        GamePayloads.UserLeft data = GamePayloads.UserLeft.builder()
                .userId(user.getId())
                .users(List.copyOf(room.getUsers()))
                .build();

        broadcast(room, SocketEvent.USER_LEFT, msg, data);
    }

    // 게임 진행

    public void broadcastGameStarted(Room room, GameSettings settings) {
        String msg = GameCode.GAME_STARTED.format(settings.rounds(), settings.roundDuration());
        broadcast(room, SocketEvent.GAME_STARTED, msg, roomState(room));

        Map<String, Object> busData = new LinkedHashMap<>();
        busData.put("settings", settings);
        busData.put("message", "Game started! Your messages will be treated as guesses.");
        publish("game-started", room.getRoomCode(), busData);
    }

    /**
     * 제시어 후보를 출제자 연결로만 보낸다. 연결이 없으면 조용히 건너뛴다 (후보는 이미 저장됨).
     */
    public void sendWordOptions(Room room, String drawerId, List<String> words) {
        Optional<String> drawerSession = presenceTracker.findSession(room.getRoomCode(), drawerId);
        if (drawerSession.isEmpty()) {
            log.info("출제자 연결 없음, 제시어 전달 생략: room={}, drawer={}", room.getRoomCode(), drawerId);
            return;
        }

        GamePayloads.WordOptions data = GamePayloads.WordOptions.builder()
                .words(List.copyOf(words))
                .build();

        send(drawerSession.get(), SocketEvent.WORD_OPTIONS, GameCode.CHOOSE_WORD.getMessage(), data);
    }

    public void broadcastWordSelected(Room room, Player drawer) {
        String nickname = drawer != null ? drawer.getNickname() : "Player";

        GamePayloads.WordSelected data = GamePayloads.WordSelected.builder()
                .room(RoomSnapshot.from(room))
                .wordDisplay(room.getMaskedWord())
                .roundDuration(room.getRoundDuration())
                .roundEndTime(room.getRoundEndTime())
                .build();

        broadcast(room, SocketEvent.WORD_SELECTED, GameCode.NOW_DRAWING.format(nickname), data);

        Map<String, Object> busData = new LinkedHashMap<>();
        busData.put("drawerId", room.getCurrentDrawer());
        busData.put("word", room.getCurrentWord());
        publish("word-selected", room.getRoomCode(), busData);
    }

    public void sendDrawerWord(String sessionId, String word) {
        GamePayloads.DrawerWord data = GamePayloads.DrawerWord.builder()
                .word(word)
                .build();

        send(sessionId, SocketEvent.DRAWER_WORD, GameCode.YOU_ARE_DRAWING.format(word), data);
    }

    public void broadcastCorrectGuess(Room room, Player guesser, Player drawer, int points, int drawerPoints) {
        String drawerName = drawer != null ? drawer.getNickname() : null;
        String msg = GameCode.CORRECT_GUESS.format(
                guesser.getNickname(), room.getCurrentWord(), points, drawerName, drawerPoints);

        GamePayloads.CorrectGuess data = GamePayloads.CorrectGuess.builder()
                .userId(guesser.getId())
                .username(guesser.getNickname())
                .word(room.getCurrentWord())
                .points(points)
                .totalScore(guesser.getScore())
                .drawerPoints(drawerPoints)
                .drawerScore(drawer != null ? drawer.getScore() : 0)
                .build();

        broadcast(room, SocketEvent.CORRECT_GUESS, msg, data);

        Map<String, Object> busData = new LinkedHashMap<>();
        busData.put("userId", guesser.getId());
        busData.put("username", guesser.getNickname());
        busData.put("word", room.getCurrentWord());
        busData.put("points", points);
        busData.put("totalScore", guesser.getScore());
        publish("correct-guess", room.getRoomCode(), busData);
    }

    public void broadcastNewRound(Room room, Player drawer) {
        String msg = GameCode.NEW_ROUND.format(room.getCurrentRound(), room.getRounds(), drawer.getNickname());
        broadcast(room, SocketEvent.NEW_ROUND, msg, roomState(room));
        broadcastCanvasClear(room, SocketEvent.CLEAR_CANVAS_ROUND);

        Map<String, Object> busData = new LinkedHashMap<>();
        busData.put("drawerId", room.getCurrentDrawer());
        busData.put("round", room.getCurrentRound());
        publish("round-started", room.getRoomCode(), busData);
    }

    /**
     * @param forced 인원 부족으로 인한 강제 종료 여부
     */
    public void broadcastGameEnded(Room room, GameResult result, boolean forced) {
        String msg = forced
                ? GameCode.GAME_ENDED_INSUFFICIENT.format(result.summary())
                : GameCode.GAME_ENDED.format(result.summary());

        GamePayloads.GameEnded data = GamePayloads.GameEnded.builder()
                .room(RoomSnapshot.from(room))
                .winner(result.winner())
                .winners(result.winners())
                .finalScores(result.finalScores())
                .build();

        broadcast(room, SocketEvent.GAME_ENDED, msg, data);

        Map<String, Object> busData = new LinkedHashMap<>();
        busData.put("winner", result.winner());
        busData.put("finalScores", result.finalScores());
        busData.put("message", "Game ended! Back to chat mode.");
        publish("game-ended", room.getRoomCode(), busData);

        if (!forced) {
            broadcastCanvasClear(room, SocketEvent.CLEAR_CANVAS_GAME_END);
        }
    }

    public void broadcastGameRestarted(Room room) {
        broadcast(room, SocketEvent.GAME_RESTARTED, GameCode.GAME_RESTARTED.getMessage(), roomState(room));
        broadcastCanvasClear(room, SocketEvent.CLEAR_CANVAS_GAME_END);
    }

    // 에러

    public void sendError(String sessionId, ErrorCode errorCode, Object... args) {
        if (sessionId == null) return;

        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.ERROR.getValue())
                .message(args.length == 0 ? errorCode.getMessage() : errorCode.format(args))
                .code(errorCode.name())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    private void broadcastCanvasClear(Room room, SocketEvent event) {
        GamePayloads.CanvasClear data = GamePayloads.CanvasClear.builder()
                .roomCode(room.getRoomCode())
                .build();
        broadcast(room, event, null, data);
    }

    private GamePayloads.RoomState roomState(Room room) {
        return GamePayloads.RoomState.builder()
                .room(RoomSnapshot.from(room))
                .build();
    }

    private <T> void broadcast(Room room, SocketEvent event, String message, T data) {
        WebSocketResponse<T> response = WebSocketResponse.<T>builder()
                .event(event.getValue())
                .message(message)
                .data(data)
                .build();
        webSocketSender.broadcastToRoom(room.getRoomCode(), response);
    }

    private <T> void send(String sessionId, SocketEvent event, String message, T data) {
        WebSocketResponse<T> response = WebSocketResponse.<T>builder()
                .event(event.getValue())
                .message(message)
                .data(data)
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    // 외부 버스 실패는 방 안 브로드캐스트에 영향을 주지 않는다
    private void publish(String type, String roomCode, Object data) {
        eventPublisher.ifPresent(publisher -> {
            try {
                publisher.publish(type, roomCode, data);
            } catch (RuntimeException e) {
                log.error("게임 이벤트 발행 실패: type={}, room={}", type, roomCode, e);
            }
        });
    }
}

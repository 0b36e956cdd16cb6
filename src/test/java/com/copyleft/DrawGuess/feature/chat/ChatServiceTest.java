package com.copyleft.DrawGuess.feature.chat;

import com.copyleft.DrawGuess.domain.Player;
import com.copyleft.DrawGuess.domain.Room;
import com.copyleft.DrawGuess.domain.vo.GameSettings;
import com.copyleft.DrawGuess.feature.game.GameRoomLockFacade;
import com.copyleft.DrawGuess.feature.game.GuessService;
import com.copyleft.DrawGuess.feature.game.LockResult;
import com.copyleft.DrawGuess.feature.presence.PresenceTracker;
import com.copyleft.DrawGuess.global.constant.ErrorCode;
import com.copyleft.DrawGuess.global.exception.BackendUnavailableException;
import com.copyleft.DrawGuess.infra.persistence.RoomRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatServiceTest {

    @Mock private RoomRepository roomRepository;
    @Mock private GameRoomLockFacade lockFacade;
    @Mock private GuessService guessService;
    @Mock private ChatResponseSender chatResponseSender;

    private final PresenceTracker presenceTracker = new PresenceTracker();
    private ChatService chatService;
    private Room room;

    @BeforeEach
    void setUp() {
        chatService = new ChatService(roomRepository, lockFacade, presenceTracker, guessService, chatResponseSender);

        room = Room.create("ROOM01", Player.createHost("A", "Amy"));
        room.addUser(Player.createGuest("B", "Ben"));
        presenceTracker.bind("s-A", "ROOM01", "A");
        presenceTracker.bind("s-B", "ROOM01", "B");

        lenient().when(roomRepository.findByCode("ROOM01")).thenReturn(Optional.of(room));
        lenient().doAnswer(invocation -> {
            Runnable action = invocation.getArgument(1);
            action.run();
            return LockResult.skipped();
        }).when(lockFacade).execute(anyString(), any(Runnable.class));
    }

    private void startDrawing(String drawerId, String word) {
        room.startGame(new GameSettings(3, 10, 60), drawerId);
        room.offerWordOptions(List.of(word, "tree", "moon"));
        room.selectWord(word, System.currentTimeMillis());
    }

    @Test
    @DisplayName("게임 밖에서는 일반 채팅으로 방 전체에 전달된다")
    void chat_Lobby() {
        // when
        chatService.processChat("s-B", "hello");

        // then
        verify(chatResponseSender).broadcastChat("ROOM01", room.findUser("B").orElseThrow(), "hello");
        verifyNoInteractions(guessService);
    }

    @Test
    @DisplayName("빈 메시지는 CHAT_EMPTY")
    void chat_Empty() {
        // when
        chatService.processChat("s-B", "   ");

        // then
        verify(chatResponseSender).sendError("s-B", ErrorCode.CHAT_EMPTY);
        verifyNoInteractions(lockFacade);
    }

    @Test
    @DisplayName("방에 연결되지 않은 세션은 NOT_IN_ROOM")
    void chat_NotInRoom() {
        // when
        chatService.processChat("s-X", "hello");

        // then
        verify(chatResponseSender).sendError("s-X", ErrorCode.NOT_IN_ROOM);
    }

    @Test
    @DisplayName("그림 단계의 출제자 채팅은 차단된다")
    void chat_DrawerBlocked() {
        // given
        startDrawing("A", "cat");

        // when
        chatService.processChat("s-A", "it's a cat");

        // then
        verify(chatResponseSender).sendError("s-A", ErrorCode.CHAT_BLOCKED_FOR_DRAWER);
        verify(chatResponseSender, never()).broadcastChat(anyString(), any(), anyString());
        verifyNoInteractions(guessService);
    }

    @Test
    @DisplayName("그림 단계의 다른 플레이어 채팅은 추측으로 판정된다")
    void chat_TreatedAsGuess() {
        // given
        startDrawing("A", "cat");

        // when
        chatService.processChat("s-B", "cat");

        // then
        verify(guessService).applyGuess(room, "B", "cat", true);
        verify(chatResponseSender, never()).broadcastChat(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("제시어 선택 단계에서는 일반 채팅")
    void chat_WordSelection() {
        // given
        room.startGame(new GameSettings(3, 10, 60), "A");

        // when
        chatService.processChat("s-A", "choosing...");

        // then
        verify(chatResponseSender).broadcastChat("ROOM01", room.findUser("A").orElseThrow(), "choosing...");
        verify(guessService, never()).applyGuess(any(), anyString(), anyString(), anyBoolean());
    }

    @Test
    @DisplayName("방에서 이미 빠진 유저는 USER_NOT_IN_ROOM")
    void chat_UserRemoved() {
        // given
        room.removeUser("B");

        // when
        chatService.processChat("s-B", "hello");

        // then
        verify(chatResponseSender).sendError("s-B", ErrorCode.USER_NOT_IN_ROOM);
    }

    @Test
    @DisplayName("캐시 장애 시 SERVER_ERROR")
    void chat_BackendDown() {
        // given
        when(roomRepository.findByCode("ROOM01")).thenThrow(new BackendUnavailableException("redis down", null));

        // when
        chatService.processChat("s-B", "hello");

        // then
        verify(chatResponseSender).sendError("s-B", ErrorCode.SERVER_ERROR);
    }

    @Test
    @DisplayName("락 획득 실패 시 SERVER_ERROR")
    void chat_LockFailed() {
        // given
        doReturn(LockResult.lockFailed()).when(lockFacade).execute(anyString(), any(Runnable.class));

        // when
        chatService.processChat("s-B", "hello");

        // then
        verify(chatResponseSender).sendError("s-B", ErrorCode.SERVER_ERROR);
        verify(chatResponseSender, never()).broadcastChat(anyString(), any(), anyString());
    }
}

package com.copyleft.DrawGuess.feature.room;

import com.copyleft.DrawGuess.feature.room.dto.NicknameRequest;
import com.copyleft.DrawGuess.feature.room.dto.RoomResponses;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class RoomController {

    private final RoomService roomService;

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/rooms/{roomCode}")
    public RoomResponses.Detail getRoom(@PathVariable String roomCode) {
        return roomService.getRoom(roomCode);
    }

    @PostMapping("/rooms")
    @ResponseStatus(HttpStatus.CREATED)
    public RoomResponses.Created createRoom(@RequestBody(required = false) NicknameRequest request) {
        return roomService.createRoom(request != null ? request.getNickname() : null);
    }

    @PostMapping("/rooms/{roomCode}/join")
    public RoomResponses.Joined joinRoom(@PathVariable String roomCode,
                                         @RequestBody(required = false) NicknameRequest request) {
        return roomService.joinRoom(roomCode, request != null ? request.getNickname() : null);
    }

    @DeleteMapping("/rooms/{roomCode}")
    public Map<String, String> deleteRoom(@PathVariable String roomCode) {
        return Map.of("message", roomService.deleteRoom(roomCode));
    }
}

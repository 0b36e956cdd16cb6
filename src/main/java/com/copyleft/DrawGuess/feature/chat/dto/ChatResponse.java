package com.copyleft.DrawGuess.feature.chat.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ChatResponse {
    private String userId;
    private String nickname;
    private String message;
    private long timestamp;
}

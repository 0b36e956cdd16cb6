package com.copyleft.DrawGuess.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.event-bus")
public record EventBusProperties(
        boolean enabled,      // 외부 서비스(채팅 등)로 게임 이벤트 발행 여부
        String topicPrefix,   // 이벤트 토픽 접두사 (game.event.)
        String requestTopic   // 다른 서비스의 요청 수신 토픽
) {

    public String eventTopic(String type) {
        return topicPrefix + type;
    }
}

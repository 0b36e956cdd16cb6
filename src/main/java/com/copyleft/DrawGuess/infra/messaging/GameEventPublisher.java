package com.copyleft.DrawGuess.infra.messaging;

/**
 * 게임 상태 변화를 외부 서비스(채팅, 그림 서비스 등)로 알리는 이벤트 버스.
 * 구현체가 없으면 발행만 생략되고 방 안의 동작은 그대로다.
 */
public interface GameEventPublisher {

    /**
     * 실패해도 예외를 던지지 않는다.
     */
    void publish(String type, String roomCode, Object data);
}

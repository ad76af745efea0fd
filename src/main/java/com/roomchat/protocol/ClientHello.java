package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 접속 인사. 신원은 이미 핸드셰이크에서 결정되었으므로 클라이언트 정보만 담는다.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ClientHello implements ClientEvent {

    private final String clientName;
    private final String clientVersion;

    @Override
    public ClientEventType getType() {
        return ClientEventType.HELLO;
    }
}

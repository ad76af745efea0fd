package com.roomchat.protocol;

/**
 * 역직렬화 + 스키마 검증을 통과한 인바운드 이벤트의 닫힌 합 타입
 */
public sealed interface ClientEvent
        permits ClientHello, ClientMessageSend, ClientDmIdentityPublish, ClientDmOpen, ClientDmMessageSend,
                ClientModerationUserDeny, ClientModerationUserAllow {

    ClientEventType getType();
}

package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 새 DM. 두 참여자의 연결에만 전달된다.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ServerDmMessageNew implements ServerEvent {

    private final DmMessageCipher message;

    @Override
    public ServerEventType getType() {
        return ServerEventType.DM_MESSAGE_NEW;
    }
}

package com.roomchat.room.message;

import com.roomchat.protocol.ServerMessageNew;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 같은 메시지에 대한 공개용/발신자용 server/message.new 한 쌍
 */
@Getter
@AllArgsConstructor
@ToString
public final class CorrelatedMessageEvents {
    private final ServerMessageNew publicEvent;
    private final ServerMessageNew senderEvent;
}

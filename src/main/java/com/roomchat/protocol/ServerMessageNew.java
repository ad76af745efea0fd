package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * @class ServerMessageNew
 * @brief 새 채팅 메시지. 공개용/발신자용 두 variant 는 clientMessageId 유무만 다르다.
 * @see com.roomchat.room.message.MessageCorrelation
 */
@EqualsAndHashCode
@ToString
public final class ServerMessageNew implements ServerEvent {

    private final ChatMessagePlain message;
    private final String clientMessageId;

    private ServerMessageNew(ChatMessagePlain message, String clientMessageId) {
        this.message = Objects.requireNonNull(message, "message");
        this.clientMessageId = clientMessageId;
    }

    /** 공개 variant: correlation id 없음 */
    public static ServerMessageNew publicVariant(ChatMessagePlain message) {
        return new ServerMessageNew(message, null);
    }

    /** 발신자 variant: correlation id 포함 */
    public static ServerMessageNew senderVariant(ChatMessagePlain message, String clientMessageId) {
        return new ServerMessageNew(message, Objects.requireNonNull(clientMessageId, "clientMessageId"));
    }

    public ChatMessagePlain getMessage() {
        return message;
    }

    public Optional<String> getClientMessageId() {
        return Optional.ofNullable(clientMessageId);
    }

    @Override
    public ServerEventType getType() {
        return ServerEventType.MESSAGE_NEW;
    }
}

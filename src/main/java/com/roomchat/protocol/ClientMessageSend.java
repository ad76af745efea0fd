package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * 채팅 전송 요청 { type: "client/message.send", text, clientMessageId? }
 */
@EqualsAndHashCode
@ToString(exclude = "text")
public final class ClientMessageSend implements ClientEvent {

    private final String text;
    private final String clientMessageId;

    public ClientMessageSend(String text, String clientMessageId) {
        this.text = Objects.requireNonNull(text, "text");
        this.clientMessageId = clientMessageId;
    }

    public String getText() {
        return text;
    }

    public Optional<String> getClientMessageId() {
        return Optional.ofNullable(clientMessageId);
    }

    @Override
    public ClientEventType getType() {
        return ClientEventType.MESSAGE_SEND;
    }
}

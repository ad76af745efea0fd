package com.roomchat.protocol;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * DM 전송 요청. 발신자는 핸드셰이크 신원으로 정해지므로 여기 싣지 않는다.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString(exclude = {"nonce", "ciphertext"})
public final class ClientDmMessageSend implements ClientEvent {

    @NonNull
    private final String dmId;
    @NonNull
    private final String recipientGithubUserId;
    @NonNull
    private final DmIdentity senderIdentity;
    @NonNull
    private final DmIdentity recipientIdentity;
    @NonNull
    private final String nonce;
    @NonNull
    private final String ciphertext;

    @Override
    public ClientEventType getType() {
        return ClientEventType.DM_MESSAGE_SEND;
    }
}

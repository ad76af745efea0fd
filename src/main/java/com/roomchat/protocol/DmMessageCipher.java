package com.roomchat.protocol;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Instant;

/**
 * @class DmMessageCipher
 * @brief 서버가 중계하는 DM 1건. 본문은 클라이언트가 암호화한 ciphertext 그대로이며 서버는 복호화하지 않는다.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString(exclude = {"nonce", "ciphertext"})
public final class DmMessageCipher {

    @NonNull
    private final String id;
    @NonNull
    private final String dmId;
    @NonNull
    private final AuthUser sender;
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
    @NonNull
    private final Instant createdAt;
}

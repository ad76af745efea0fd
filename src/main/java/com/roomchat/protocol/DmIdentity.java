package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * @class DmIdentity
 * @brief DM 종단간 암호화에 쓰는 사용자 공개키 묶음. 서버는 값을 보관/전달만 하고 해석하지 않는다.
 * @note cipherSuite 는 현재 "nacl.box.v1" 만 허용, publicKey 는 32 bytes 의 base64
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DmIdentity {

    public static final String CIPHER_SUITE_NACL_BOX_V1 = "nacl.box.v1";

    private final String cipherSuite;
    private final String publicKey;

    public DmIdentity(String cipherSuite, String publicKey) {
        this.cipherSuite = Objects.requireNonNull(cipherSuite, "cipherSuite");
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
    }
}

package com.roomchat.protocol;

/**
 * 핸드셰이크 거절 응답 본문의 code 값
 */
public enum HandshakeRejectionCode {
    UNAUTHORIZED("unauthorized"),
    AUTH_EXPIRED("auth_expired"),
    FORBIDDEN("forbidden"),
    RATE_LIMITED("rate_limited"),
    ROOM_FULL("room_full"),
    TOO_MANY_CONNECTIONS("too_many_connections"),
    INVALID_PAYLOAD("invalid_payload");

    private final String wireName;

    HandshakeRejectionCode(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}

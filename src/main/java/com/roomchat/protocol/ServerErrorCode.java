package com.roomchat.protocol;

/**
 * server/error 의 code 값. 오류 알림은 메시지 브로드캐스트(server/message.new)와 모양이 겹치지 않는다.
 */
public enum ServerErrorCode {
    INVALID_PAYLOAD("invalid_payload"),
    FORBIDDEN("forbidden"),
    RATE_LIMITED("rate_limited"),
    AUTH_EXPIRED("auth_expired"),
    SERVER_ERROR("server_error"),
    CONTENT_POLICY_VIOLATION("content_policy_violation");

    private final String wireName;

    ServerErrorCode(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}

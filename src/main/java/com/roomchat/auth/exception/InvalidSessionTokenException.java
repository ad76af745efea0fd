package com.roomchat.auth.exception;

/**
 * 세션 토큰 검증 실패. expired 는 서명은 맞지만 만료된 경우 (클라이언트가 재발급으로 복구 가능).
 */
public class InvalidSessionTokenException extends Exception {

    private final boolean expired;

    public InvalidSessionTokenException(String message, boolean expired, Throwable cause) {
        super(message, cause);
        this.expired = expired;
    }

    public InvalidSessionTokenException(String message) {
        this(message, false, null);
    }

    public boolean isExpired() {
        return expired;
    }
}

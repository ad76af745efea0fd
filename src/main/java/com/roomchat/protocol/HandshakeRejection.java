package com.roomchat.protocol;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.OptionalLong;

/**
 * @class HandshakeRejection
 * @brief 업그레이드 전에 연결을 거절할 때의 HTTP 응답 정보 (status + JSON 본문).
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HandshakeRejection {

    private final int status;
    private final HandshakeRejectionCode code;
    private final String message;
    @Getter(AccessLevel.NONE)
    private final Long retryAfterMs;

    public HandshakeRejection(int status, HandshakeRejectionCode code, String message, Long retryAfterMs) {
        this.status = status;
        this.code = code;
        this.message = message;
        this.retryAfterMs = (retryAfterMs != null && retryAfterMs > 0) ? retryAfterMs : null;
    }

    public static HandshakeRejection rateLimited(long retryAfterMs) {
        return new HandshakeRejection(429, HandshakeRejectionCode.RATE_LIMITED, "Too many connection attempts", retryAfterMs);
    }

    public static HandshakeRejection forbidden() {
        return new HandshakeRejection(403, HandshakeRejectionCode.FORBIDDEN, "Forbidden", null);
    }

    public static HandshakeRejection roomFull() {
        return new HandshakeRejection(429, HandshakeRejectionCode.ROOM_FULL, "Room is full", null);
    }

    public static HandshakeRejection tooManyConnections() {
        return new HandshakeRejection(429, HandshakeRejectionCode.TOO_MANY_CONNECTIONS, "Too many connections", null);
    }

    public static HandshakeRejection invalidRoom() {
        return new HandshakeRejection(400, HandshakeRejectionCode.INVALID_PAYLOAD, "Invalid room", null);
    }

    public static HandshakeRejection unauthorized() {
        return new HandshakeRejection(401, HandshakeRejectionCode.UNAUTHORIZED, "Unauthorized", null);
    }

    public static HandshakeRejection authExpired() {
        return new HandshakeRejection(401, HandshakeRejectionCode.AUTH_EXPIRED, "Session expired", null);
    }

    public OptionalLong getRetryAfterMs() {
        return retryAfterMs == null ? OptionalLong.empty() : OptionalLong.of(retryAfterMs);
    }
}

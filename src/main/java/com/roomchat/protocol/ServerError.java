package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 요청한 연결 하나에만 보내는 소프트 오류 알림
 */
@EqualsAndHashCode
@ToString
public final class ServerError implements ServerEvent {

    private final ServerErrorCode code;
    private final String message;
    private final Long retryAfterMs;

    public ServerError(ServerErrorCode code, String message, Long retryAfterMs) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = message;
        // 0 이하는 의미 없음 (wire 상 양수만 허용)
        this.retryAfterMs = (retryAfterMs != null && retryAfterMs > 0) ? retryAfterMs : null;
    }

    public static ServerError of(ServerErrorCode code, String message) {
        return new ServerError(code, message, null);
    }

    public ServerErrorCode getCode() {
        return code;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public OptionalLong getRetryAfterMs() {
        return retryAfterMs == null ? OptionalLong.empty() : OptionalLong.of(retryAfterMs);
    }

    @Override
    public ServerEventType getType() {
        return ServerEventType.ERROR;
    }
}

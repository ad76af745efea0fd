package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 연결 직후 1회: 본인 신원, 서버 시각, 방 히스토리
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ServerWelcome implements ServerEvent {

    private final AuthUser user;
    private final Instant serverTime;
    private final List<ChatMessagePlain> history;

    public ServerWelcome(AuthUser user, Instant serverTime, List<ChatMessagePlain> history) {
        this.user = user;
        this.serverTime = serverTime;
        this.history = Collections.unmodifiableList(history);
    }

    @Override
    public ServerEventType getType() {
        return ServerEventType.WELCOME;
    }
}

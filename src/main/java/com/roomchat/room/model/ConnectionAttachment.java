package com.roomchat.room.model;

import com.roomchat.protocol.AuthUser;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * @class ConnectionAttachment
 * @brief 방에 붙은 연결 1개의 정보 (연결 ID, 사용자, 입장 시각, 전송 채널, 송신 대기열).
 * @note 연결 arena(ConnectionRegistry)의 값. presence 계산은 여기서 channel 을 제외한 정보만 읽는다.
 *       엔진은 channel 에 직접 쓰지 않고 outbound 에 적재한다.
 */
@Getter
@ToString(exclude = {"channel", "outbound"})
public final class ConnectionAttachment {

    private final String connectionId;
    private final AuthUser user;
    private final Instant joinedAt;
    private final ConnectionChannel channel;
    private final OutboundQueue outbound;

    public ConnectionAttachment(AuthUser user, Instant joinedAt, ConnectionChannel channel, OutboundQueue outbound) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.connectionId = channel.getId();
        this.user = Objects.requireNonNull(user, "user");
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
    }

    public String getGithubUserId() {
        return user.getGithubUserId();
    }
}

package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * client/dm.open 응답: 대화 ID, 상대 ID, 상대 공개키(등록돼 있으면), DM 히스토리
 */
@EqualsAndHashCode
@ToString
public final class ServerDmWelcome implements ServerEvent {

    private final String dmId;
    private final String peerGithubUserId;
    private final DmIdentity peerIdentity;
    private final List<DmMessageCipher> history;

    public ServerDmWelcome(String dmId, String peerGithubUserId, DmIdentity peerIdentity, List<DmMessageCipher> history) {
        this.dmId = Objects.requireNonNull(dmId, "dmId");
        this.peerGithubUserId = Objects.requireNonNull(peerGithubUserId, "peerGithubUserId");
        this.peerIdentity = peerIdentity;
        this.history = Collections.unmodifiableList(history);
    }

    public String getDmId() {
        return dmId;
    }

    public String getPeerGithubUserId() {
        return peerGithubUserId;
    }

    public Optional<DmIdentity> getPeerIdentity() {
        return Optional.ofNullable(peerIdentity);
    }

    public List<DmMessageCipher> getHistory() {
        return history;
    }

    @Override
    public ServerEventType getType() {
        return ServerEventType.DM_WELCOME;
    }
}

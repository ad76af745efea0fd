package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ServerModerationUserAllowed implements ServerEvent {

    private final String actorGithubUserId;
    private final String targetGithubUserId;

    @Override
    public ServerEventType getType() {
        return ServerEventType.MODERATION_USER_ALLOWED;
    }
}

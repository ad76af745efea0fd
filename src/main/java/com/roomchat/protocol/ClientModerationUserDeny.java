package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ClientModerationUserDeny implements ClientEvent {

    private final String targetGithubUserId;
    private final String reason;

    @Override
    public ClientEventType getType() {
        return ClientEventType.MODERATION_USER_DENY;
    }
}

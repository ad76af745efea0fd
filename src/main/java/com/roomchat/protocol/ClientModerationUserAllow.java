package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ClientModerationUserAllow implements ClientEvent {

    private final String targetGithubUserId;

    @Override
    public ClientEventType getType() {
        return ClientEventType.MODERATION_USER_ALLOW;
    }
}

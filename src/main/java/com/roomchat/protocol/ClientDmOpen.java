package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ClientDmOpen implements ClientEvent {

    private final String targetGithubUserId;

    @Override
    public ClientEventType getType() {
        return ClientEventType.DM_OPEN;
    }
}

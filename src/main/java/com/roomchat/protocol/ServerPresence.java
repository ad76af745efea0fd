package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ServerPresence implements ServerEvent {

    private final PresenceSnapshot snapshot;

    @Override
    public ServerEventType getType() {
        return ServerEventType.PRESENCE;
    }
}

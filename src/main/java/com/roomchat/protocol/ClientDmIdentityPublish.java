package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 본인 DM 공개키 등록 { type: "client/dm.identity.publish", identity }
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ClientDmIdentityPublish implements ClientEvent {

    private final DmIdentity identity;

    @Override
    public ClientEventType getType() {
        return ClientEventType.DM_IDENTITY_PUBLISH;
    }
}

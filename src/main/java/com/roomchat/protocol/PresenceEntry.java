package com.roomchat.protocol;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * presence 한 줄: 사용자 신원 + 해당 사용자의 활성 연결 수
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class PresenceEntry {
    private final AuthUser user;
    private final int connections;
}

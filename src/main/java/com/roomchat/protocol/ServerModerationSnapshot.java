package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 모더레이터 전용: 운영자 차단 목록 + 방 차단 목록 (정렬됨)
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ServerModerationSnapshot implements ServerEvent {

    private final List<String> operatorDeniedGithubUserIds;
    private final List<String> roomDeniedGithubUserIds;

    public ServerModerationSnapshot(List<String> operatorDeniedGithubUserIds, List<String> roomDeniedGithubUserIds) {
        this.operatorDeniedGithubUserIds = List.copyOf(operatorDeniedGithubUserIds);
        this.roomDeniedGithubUserIds = List.copyOf(roomDeniedGithubUserIds);
    }

    @Override
    public ServerEventType getType() {
        return ServerEventType.MODERATION_SNAPSHOT;
    }
}

package com.roomchat.room.core;

import com.roomchat.contentpolicy.CompiledDenylist;
import com.roomchat.contentpolicy.ContentPolicyMode;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;
import java.util.Set;

/**
 * @class RoomGuardrails
 * @brief 모든 방 엔진이 공유하는 제한값 묶음 (설정에서 1회 생성, 불변).
 */
@Getter
@Builder
@ToString(exclude = "compiledDenylist")
public final class RoomGuardrails {

    @NonNull
    private final Duration messageRateWindow;
    private final int messageRateMaxCount;

    private final int maxConnectionsPerUser;
    /** null 이면 제한 없음 */
    private final Integer maxConnectionsPerRoom;

    private final int historyLimit;
    private final int historyPersistEveryNMessages;

    @NonNull
    private final ContentPolicyMode contentPolicyMode;
    @NonNull
    private final CompiledDenylist compiledDenylist;

    @NonNull
    private final Set<String> operatorDeniedGithubUserIds;
}

package com.roomchat.presence;

import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.PresenceEntry;
import com.roomchat.protocol.PresenceSnapshot;
import com.roomchat.room.model.ConnectionAttachment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @class PresenceDerivation
 * @brief 현재 연결 집합 → presence snapshot 계산 (순수 함수).
 *
 * @details
 * - exclude 에 포함된 연결 ID 는 건너뛴다. 방금 끊긴 연결이 arena 에서 빠지기 전이라도 집계되지 않게 하기 위함.
 * - 사용자 ID 기준으로 묶어 연결 수를 센다. 사용자 정보는 처음 만난 연결의 값을 쓴다.
 * - 결과 정렬: login → githubUserId (문자열 비교)
 */
public final class PresenceDerivation {

    private static final Comparator<PresenceEntry> ORDER = Comparator
            .comparing((PresenceEntry entry) -> entry.getUser().getLogin())
            .thenComparing(entry -> entry.getUser().getGithubUserId());

    private PresenceDerivation() {
    }

    public static PresenceSnapshot derivePresenceSnapshotFromConnections(Collection<ConnectionAttachment> connections,
                                                                         Set<String> excludeConnectionIds) {
        Map<String, AuthUser> users = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (ConnectionAttachment connection : connections) {
            if (excludeConnectionIds != null && excludeConnectionIds.contains(connection.getConnectionId())) {
                continue;
            }
            String githubUserId = connection.getGithubUserId();
            users.putIfAbsent(githubUserId, connection.getUser());
            counts.merge(githubUserId, 1, Integer::sum);
        }

        List<PresenceEntry> entries = new ArrayList<>(users.size());
        for (Map.Entry<String, AuthUser> entry : users.entrySet()) {
            entries.add(new PresenceEntry(entry.getValue(), counts.get(entry.getKey())));
        }
        entries.sort(ORDER);
        return new PresenceSnapshot(entries);
    }

    public static PresenceSnapshot derivePresenceSnapshotFromConnections(Collection<ConnectionAttachment> connections) {
        return derivePresenceSnapshotFromConnections(connections, Set.of());
    }
}

package com.roomchat.room.core;

import com.roomchat.room.model.ConnectionAttachment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @class ConnectionRegistry
 * @brief 방 1개의 연결 arena: 연결 ID → ConnectionAttachment, 그리고 연결별 연속 invalid payload 횟수.
 *
 * @details
 * - 연결은 ID 로만 참조한다. 제거는 remove() 명시 호출 뿐이며, 제거하면 strike 기록도 같이 지운다.
 * - 입장 순서를 유지한다 (LinkedHashMap). 브로드캐스트 순서가 입장 순서와 같다.
 * - 스레드 안전하지 않음: 방 엔진 lock 안에서만 호출한다.
 */
class ConnectionRegistry {

    private final Map<String, ConnectionAttachment> connections = new LinkedHashMap<>();
    private final Map<String, Integer> invalidPayloadStrikes = new HashMap<>();

    void add(ConnectionAttachment attachment) {
        connections.put(attachment.getConnectionId(), attachment);
    }

    ConnectionAttachment get(String connectionId) {
        return connections.get(connectionId);
    }

    /**
     * @return 제거된 연결, 없던 연결이면 null
     */
    ConnectionAttachment remove(String connectionId) {
        invalidPayloadStrikes.remove(connectionId);
        return connections.remove(connectionId);
    }

    /**
     * @return 이번 기록을 포함한 연속 횟수
     */
    int recordStrike(String connectionId) {
        return invalidPayloadStrikes.merge(connectionId, 1, Integer::sum);
    }

    void resetStrikes(String connectionId) {
        invalidPayloadStrikes.remove(connectionId);
    }

    int strikes(String connectionId) {
        return invalidPayloadStrikes.getOrDefault(connectionId, 0);
    }

    /** 순회 중 제거가 가능하도록 복사본을 돌려준다 */
    List<ConnectionAttachment> all() {
        return new ArrayList<>(connections.values());
    }

    Collection<ConnectionAttachment> view() {
        return connections.values();
    }

    List<ConnectionAttachment> byUser(String githubUserId) {
        List<ConnectionAttachment> result = new ArrayList<>();
        for (ConnectionAttachment attachment : connections.values()) {
            if (attachment.getGithubUserId().equals(githubUserId)) {
                result.add(attachment);
            }
        }
        return result;
    }

    int countForUser(String githubUserId) {
        int count = 0;
        for (ConnectionAttachment attachment : connections.values()) {
            if (attachment.getGithubUserId().equals(githubUserId)) {
                count++;
            }
        }
        return count;
    }

    int size() {
        return connections.size();
    }

    boolean isEmpty() {
        return connections.isEmpty();
    }

    void clear() {
        connections.clear();
        invalidPayloadStrikes.clear();
    }
}

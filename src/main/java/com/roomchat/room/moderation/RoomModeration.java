package com.roomchat.room.moderation;

import com.roomchat.protocol.InvalidPayloadException;
import com.roomchat.protocol.ProtocolCodec;
import com.roomchat.protocol.ServerModerationSnapshot;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.storage.RoomStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * @class RoomModeration
 * @brief 방 입장 차단 상태: 운영자 차단(설정, 불변) + 방 차단(모더레이터가 변경, 저장소에 유지).
 *
 * @details
 * - 두 목록 중 하나에라도 있으면 입장 거부 대상.
 * - 방 차단 목록은 "denied_github_user_ids" 에 정렬된 JSON 배열로 저장한다.
 * - 운영자 차단은 모더레이터가 해제할 수 없다.
 * - 권한 검사 / 강퇴 / 알림 전송은 방 엔진 몫이고, 여기서는 상태만 다룬다.
 * - 스레드 안전하지 않음: 방 엔진 lock 안에서만 호출한다.
 */
public class RoomModeration {

    private static final Logger logger = LoggerFactory.getLogger(RoomModeration.class);

    private final String roomId;
    private final Set<String> operatorDenied;
    private final TreeSet<String> roomDenied = new TreeSet<>();
    private final RoomStorage storage;

    public RoomModeration(String roomId, Set<String> operatorDeniedGithubUserIds, RoomStorage storage) {
        this.roomId = roomId;
        this.operatorDenied = Collections.unmodifiableSet(new TreeSet<>(operatorDeniedGithubUserIds));
        this.storage = storage;
        load();
    }

    public boolean isDenied(String githubUserId) {
        return operatorDenied.contains(githubUserId) || roomDenied.contains(githubUserId);
    }

    public boolean isOperatorDenied(String githubUserId) {
        return operatorDenied.contains(githubUserId);
    }

    public boolean isRoomDenied(String githubUserId) {
        return roomDenied.contains(githubUserId);
    }

    /**
     * @return 새로 추가되었으면 true (이미 어느 목록에든 있으면 false, 저장하지 않음)
     */
    public boolean deny(String githubUserId) {
        if (isDenied(githubUserId)) {
            return false;
        }
        roomDenied.add(githubUserId);
        persist();
        return true;
    }

    /**
     * @return 방 차단 목록에서 실제로 제거되었으면 true
     * @note 운영자 차단 여부는 호출 측에서 먼저 확인한다.
     */
    public boolean allow(String githubUserId) {
        if (!roomDenied.remove(githubUserId)) {
            return false;
        }
        persist();
        return true;
    }

    public ServerModerationSnapshot snapshot() {
        return new ServerModerationSnapshot(new ArrayList<>(operatorDenied), new ArrayList<>(roomDenied));
    }

    public List<String> getRoomDeniedGithubUserIds() {
        return new ArrayList<>(roomDenied);
    }

    private void persist() {
        try {
            storage.put(RoomConstants.ROOM_DENYLIST_KEY, ProtocolCodec.encodeIdList(roomDenied));
        } catch (RuntimeException e) {
            logger.error("[방 차단 목록 저장 실패] roomId={}, size={}", roomId, roomDenied.size(), e);
        }
    }

    private void load() {
        Optional<String> saved;
        try {
            saved = storage.get(RoomConstants.ROOM_DENYLIST_KEY);
        } catch (RuntimeException e) {
            logger.error("[방 차단 목록 로드 실패] roomId={} - 빈 목록으로 시작", roomId, e);
            return;
        }
        if (saved.isEmpty()) {
            return;
        }
        try {
            roomDenied.addAll(ProtocolCodec.decodeIdList(saved.get()));
        } catch (InvalidPayloadException e) {
            logger.warn("[방 차단 목록 로드] roomId={} - 저장값이 배열이 아님, 무시", roomId);
            return;
        }
        logger.info("[방 차단 목록 로드] roomId={}, count={}", roomId, roomDenied.size());
    }
}

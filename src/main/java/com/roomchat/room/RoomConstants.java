package com.roomchat.room;

import java.time.Duration;

/**
 * 방 엔진 고정 상수 (설정으로 바꾸지 않는 값)
 */
public final class RoomConstants {

    /** 방 저장소 key: 히스토리 */
    public static final String HISTORY_KEY = "history";
    /** 방 저장소 key: 방 차단 사용자 목록 */
    public static final String ROOM_DENYLIST_KEY = "denied_github_user_ids";
    /** 방 저장소 key: 사용자별 DM 공개키 */
    public static final String DM_IDENTITIES_KEY = "dm_identities";
    /** DM 대화 저장소(scope = dmId) key: DM 히스토리 */
    public static final String DM_HISTORY_KEY = "dm_history";

    /** 메모리에 올려 두는 DM 대화 히스토리 수. 넘으면 가장 오래 안 쓴 대화를 저장 후 내린다 */
    public static final int DM_HISTORY_MAX_CACHED_CONVERSATIONS = 1_024;

    /** 연결 1개의 미전송 프레임 한도. 넘으면 느린 연결로 보고 끊는다 */
    public static final int OUTBOUND_MAX_PENDING_FRAMES = 1_000;

    public static final Duration PRESENCE_BROADCAST_COALESCE_WINDOW = Duration.ofMillis(200);
    public static final int ROOM_RATE_LIMIT_MAX_TRACKED_KEYS = 20_000;

    public static final int WS_MAX_INBOUND_MESSAGE_BYTES = 16_384;
    public static final int WS_MAX_CONSECUTIVE_INVALID_PAYLOADS = 3;

    // close code / reason
    public static final int CLOSE_POLICY_VIOLATION = 1008;
    public static final int CLOSE_SERVER_ERROR = 1011;
    public static final int CLOSE_GOING_AWAY = 1001;
    public static final String CLOSE_REASON_INVALID_PAYLOAD = "invalid_payload";
    public static final String CLOSE_REASON_BANNED = "banned";
    public static final String CLOSE_REASON_TOO_MANY_CONNECTIONS = "too_many_connections";
    public static final String CLOSE_REASON_SHUTDOWN = "server_shutdown";

    private RoomConstants() {
    }
}

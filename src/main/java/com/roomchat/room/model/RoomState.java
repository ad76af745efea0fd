package com.roomchat.room.model;

/**
 * 방 엔진 생명주기.
 * IDLE(연결 0) ↔ ACTIVE(연결 1개 이상) → RETIRED(유휴 상태로 레지스트리에서 제거됨, 재사용 불가)
 */
public enum RoomState {
    IDLE,
    ACTIVE,
    RETIRED
}

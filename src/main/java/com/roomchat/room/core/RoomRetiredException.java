package com.roomchat.room.core;

/**
 * 이미 레지스트리에서 내려간(RETIRED) 방 엔진에 연결을 붙이려 할 때.
 * 호출 측(RoomRegistry)은 방을 다시 조회해서 새 엔진으로 재시도한다.
 */
public class RoomRetiredException extends RuntimeException {

    public RoomRetiredException(String roomId) {
        super("방 " + roomId + " 은(는) 이미 종료된 상태입니다.");
    }
}

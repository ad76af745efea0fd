package com.roomchat.room;

import java.util.regex.Pattern;

/**
 * 방 ID 규칙: [A-Za-z0-9_-]{1,64}, 지정하지 않으면 "global"
 */
public final class RoomIds {

    public static final String DEFAULT_ROOM_ID = "global";

    private static final Pattern ROOM_ID = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private RoomIds() {
    }

    public static boolean isValid(String roomId) {
        return roomId != null && ROOM_ID.matcher(roomId).matches();
    }

    /**
     * @param requested 요청 파라미터 값 (null/빈 값이면 기본 방)
     * @return 사용할 방 ID, 규칙에 맞지 않으면 null
     */
    public static String resolve(String requested) {
        if (requested == null || requested.isEmpty()) {
            return DEFAULT_ROOM_ID;
        }
        return isValid(requested) ? requested : null;
    }
}

package com.roomchat.room.storage;

import java.util.Optional;

/**
 * @interface RoomStorage
 * @brief 방 1개 범위의 key-value 저장소. 값은 JSON 문자열.
 *
 * @details
 * - key 는 방 안에서만 유일하면 된다 ("history", "denied_github_user_ids").
 * - 구현체의 인프라 예외(RuntimeException)는 호출 측에서 기록 후 흡수한다. 저장 실패가 메시지 전달을 막지 않는다.
 */
public interface RoomStorage {

    Optional<String> get(String key);

    void put(String key, String value);
}

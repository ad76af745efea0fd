package com.roomchat.room.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @class InMemoryRoomStorageProvider
 * @brief 프로세스 메모리에 방 상태를 보관하는 저장소 (chat.storage=memory). 재시작하면 사라진다.
 * @note 로컬 실행 / 테스트 용도
 */
@Component
@ConditionalOnProperty(prefix = "chat", name = "storage", havingValue = "memory")
public class InMemoryRoomStorageProvider implements RoomStorageProvider {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRoomStorageProvider.class);

    // roomId → (key → JSON)
    private final Map<String, Map<String, String>> rooms = new ConcurrentHashMap<>();

    public InMemoryRoomStorageProvider() {
        logger.info("[storage] in-memory 방 저장소 사용");
    }

    @Override
    public RoomStorage forRoom(String roomId) {
        Map<String, String> values = rooms.computeIfAbsent(roomId, id -> new ConcurrentHashMap<>());
        return new RoomStorage() {
            @Override
            public Optional<String> get(String key) {
                return Optional.ofNullable(values.get(key));
            }

            @Override
            public void put(String key, String value) {
                values.put(key, value);
            }
        };
    }
}

package com.roomchat.redis.handler;

import com.roomchat.room.storage.RoomStorage;
import com.roomchat.room.storage.RoomStorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * @class RedisRoomStorageProvider
 * @brief 방 저장소의 Redis 구현 (chat.storage=redis, 기본값).
 * @note Redis 예외(DataAccessException)는 그대로 올린다. 기록/흡수는 RoomHistory, RoomModeration 이 한다.
 */
@Component
@ConditionalOnProperty(prefix = "chat", name = "storage", havingValue = "redis", matchIfMissing = true)
public class RedisRoomStorageProvider implements RoomStorageProvider {

    private static final Logger logger = LoggerFactory.getLogger(RedisRoomStorageProvider.class);

    private final RedisHandler redisHandler;

    public RedisRoomStorageProvider(RedisHandler redisHandler) {
        this.redisHandler = redisHandler;
        logger.info("[storage] Redis 방 저장소 사용");
    }

    @Override
    public RoomStorage forRoom(String roomId) {
        return new RoomStorage() {
            @Override
            public Optional<String> get(String key) {
                return Optional.ofNullable(redisHandler.get(roomId, key));
            }

            @Override
            public void put(String key, String value) {
                redisHandler.set(roomId, key, value);
            }
        };
    }
}

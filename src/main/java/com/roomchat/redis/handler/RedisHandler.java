package com.roomchat.redis.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Component;

/**
 * @class RedisHandler
 * @brief RedisTemplate 얇은 래퍼. 방 저장소 key 규칙(roomchat:room:{roomId}:{key})을 한 곳에서 만든다.
 */
@Component
@ConditionalOnProperty(prefix = "chat", name = "storage", havingValue = "redis", matchIfMissing = true)
public class RedisHandler {

    private static final Logger logger = LoggerFactory.getLogger(RedisHandler.class);

    static final String KEY_PREFIX = "roomchat:room:";

    private final RedisTemplate<String, String> redisTemplate;

    public RedisHandler(@Qualifier("roomRedisTemplate") RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * ValueOperations : 단일 Key-Value 연산용
     */
    public ValueOperations<String, String> getValueOperations() {
        return redisTemplate.opsForValue();
    }

    public static String roomKey(String roomId, String key) {
        return KEY_PREFIX + roomId + ":" + key;
    }

    public String get(String roomId, String key) {
        return getValueOperations().get(roomKey(roomId, key));
    }

    public void set(String roomId, String key, String value) {
        getValueOperations().set(roomKey(roomId, key), value);
        logger.debug("[redis] 저장: key={}, bytes={}", roomKey(roomId, key), value.length());
    }
}

package com.roomchat.room.core;

import com.roomchat.config.ChatRoomProperties;
import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.HandshakeRejection;
import com.roomchat.room.model.ConnectionChannel;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @class RoomRegistry
 * @brief 방 ID → RoomSessionEngine. 방은 첫 접근 시 만들어지고, 유휴 TTL 이 지나면 내려간다.
 *
 * @details
 * - 방끼리는 상태를 공유하지 않는다. 각 방의 순서 보장은 엔진 lock 이 담당하고, 여기서는 조회/생성/제거만 한다.
 * - 유휴 정리와 connect 가 겹치면 connect 쪽이 RoomRetiredException 을 받고 새 엔진으로 다시 시도한다.
 */
@Component
public class RoomRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, RoomSessionEngine> rooms = new ConcurrentHashMap<>();

    private final RoomSessionEngineFactory engineFactory;
    private final Clock clock;
    private final Duration roomIdleTtl;

    public RoomRegistry(RoomSessionEngineFactory engineFactory, Clock clock, ChatRoomProperties properties) {
        this.engineFactory = engineFactory;
        this.clock = clock;
        this.roomIdleTtl = properties.getRoomIdleTtl();
    }

    public RoomSessionEngine getOrCreate(String roomId) {
        return rooms.computeIfAbsent(roomId, engineFactory::create);
    }

    public Optional<RoomSessionEngine> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Optional<HandshakeRejection> admit(String roomId, AuthUser user, String clientIp) {
        return getOrCreate(roomId).admit(user, clientIp);
    }

    public void connect(String roomId, ConnectionChannel channel, AuthUser user) {
        while (true) {
            RoomSessionEngine engine = getOrCreate(roomId);
            try {
                engine.connect(channel, user);
                return;
            } catch (RoomRetiredException e) {
                logger.debug("[connect 재시도] 종료된 방 엔진 교체: roomId={}", roomId);
                rooms.remove(roomId, engine);
            }
        }
    }

    public void disconnect(String roomId, String connectionId) {
        RoomSessionEngine engine = rooms.get(roomId);
        if (engine != null) {
            engine.disconnect(connectionId);
        }
    }

    public void receive(String roomId, String connectionId, String rawFrame) {
        RoomSessionEngine engine = rooms.get(roomId);
        if (engine != null) {
            engine.receive(connectionId, rawFrame);
        }
    }

    /**
     * @method evictIdleRooms
     * @return 이번에 내려간 방 수
     * @called_by RoomMaintenanceScheduler
     */
    public int evictIdleRooms() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<String, RoomSessionEngine> entry : rooms.entrySet()) {
            if (entry.getValue().tryRetire(now, roomIdleTtl)) {
                rooms.remove(entry.getKey(), entry.getValue());
                evicted++;
            }
        }
        if (evicted > 0) {
            logger.info("[유휴 방 정리] evicted={}, remaining={}", evicted, rooms.size());
        }
        return evicted;
    }

    public int roomCount() {
        return rooms.size();
    }

    @PreDestroy
    public void shutdown() {
        logger.info("[종료] 전체 방 종료: rooms={}", rooms.size());
        for (RoomSessionEngine engine : rooms.values()) {
            engine.shutdown();
        }
        rooms.clear();
    }
}

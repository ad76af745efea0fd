package com.roomchat.scheduler;

import com.roomchat.room.core.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RoomMaintenanceScheduler {

	private static final Logger logger = LoggerFactory.getLogger(RoomMaintenanceScheduler.class);

	private final RoomRegistry roomRegistry;

	public RoomMaintenanceScheduler(RoomRegistry roomRegistry) {
		this.roomRegistry = roomRegistry;
	}

	/**
	 * [유휴 방 정리]
	 *
	 * - 연결 0 인 상태로 chat.room-idle-ttl 이상 지난 방을 내린다 (history flush 후 제거)
	 * - 다음 접속 시 저장소에서 history/차단 목록을 다시 읽어 새 엔진이 만들어진다
	 */
	@Scheduled(fixedRate = 60 * 1000) // 1분마다 실행
	public void evictIdleRooms() {
		try {
			int evicted = roomRegistry.evictIdleRooms();
			if (evicted > 0) {
				logger.info("[유휴 방 정리] 제거={}, 남은 방={}", evicted, roomRegistry.roomCount());
			}
		} catch (RuntimeException e) {
			logger.error("[유휴 방 정리 실패] 이유: {}", e.getMessage(), e);
		}
	}
}

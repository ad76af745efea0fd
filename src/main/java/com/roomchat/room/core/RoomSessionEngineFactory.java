package com.roomchat.room.core;

import com.roomchat.ratelimit.FixedWindowRateLimiter;
import com.roomchat.room.dm.DirectMessageHistories;
import com.roomchat.room.storage.RoomStorageProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * 방 ID → 새 RoomSessionEngine. 방끼리 공유하는 자원(제한값, 스케줄러, 시계, 연결 빈도 제한기, 저장소,
 * 송신 executor, DM 히스토리)을 주입해 준다.
 */
@Component
public class RoomSessionEngineFactory {

    private final RoomGuardrails guardrails;
    private final RoomStorageProvider storageProvider;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final FixedWindowRateLimiter connectRateLimiter;
    private final Executor outboundExecutor;
    private final DirectMessageHistories dmHistories;

    public RoomSessionEngineFactory(RoomGuardrails guardrails,
                                    RoomStorageProvider storageProvider,
                                    TaskScheduler taskScheduler,
                                    Clock clock,
                                    @Qualifier("connectRateLimiter") FixedWindowRateLimiter connectRateLimiter,
                                    @Qualifier("outboundExecutor") Executor outboundExecutor,
                                    DirectMessageHistories dmHistories) {
        this.guardrails = guardrails;
        this.storageProvider = storageProvider;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.connectRateLimiter = connectRateLimiter;
        this.outboundExecutor = outboundExecutor;
        this.dmHistories = dmHistories;
    }

    public RoomSessionEngine create(String roomId) {
        return new RoomSessionEngine(roomId, guardrails, storageProvider.forRoom(roomId),
                taskScheduler, clock, connectRateLimiter, outboundExecutor, dmHistories);
    }
}

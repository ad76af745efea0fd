package com.roomchat.presence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * @class PresenceBroadcastCoalescer
 * @brief 짧은 시간 안에 몰리는 presence 재계산 요청을 1회 브로드캐스트로 합친다.
 *
 * @details
 * [상태]
 * - idle    : 예약된 타이머 없음
 * - pending : 타이머 예약됨, exclude 누적 중
 *
 * [동작]
 * 1. request(exclude?) : exclude 를 누적 집합에 합치고, idle 일 때만 window 뒤 단발 타이머 예약
 * 2. 타이머 만료       : 누적 집합을 꺼내고 idle 로 되돌린 뒤 flush 를 정확히 1번 호출
 *
 * - request 는 브로드캐스트를 기다리지 않는다 (lock 은 누적/예약 구간만).
 * - 예약 후 들어온 요청은 이미 잡힌 타이머에 합쳐지며, 타이머를 다시 미루지 않는다.
 * - flush 호출 시점에는 이미 idle 이므로 flush 안에서 다시 request 해도 새 window 가 시작된다.
 *
 * @param <T> exclude 항목 타입 (방 엔진에서는 연결 ID)
 */
public class PresenceBroadcastCoalescer<T> {

    private static final Logger logger = LoggerFactory.getLogger(PresenceBroadcastCoalescer.class);

    private final Duration window;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Consumer<Set<T>> flush;

    private final Object lock = new Object();
    private Set<T> pendingExclude = new LinkedHashSet<>();
    private ScheduledFuture<?> scheduled;

    public PresenceBroadcastCoalescer(Duration window, TaskScheduler taskScheduler, Clock clock, Consumer<Set<T>> flush) {
        this.window = Objects.requireNonNull(window, "window");
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.flush = Objects.requireNonNull(flush, "flush");
    }

    public void request() {
        request(null);
    }

    public void request(T exclude) {
        synchronized (lock) {
            if (exclude != null) {
                pendingExclude.add(exclude);
            }
            if (scheduled != null) {
                return;
            }
            scheduled = taskScheduler.schedule(this::fire, clock.instant().plus(window));
        }
    }

    public boolean isPending() {
        synchronized (lock) {
            return scheduled != null;
        }
    }

    /**
     * 예약된 브로드캐스트를 버린다 (방 종료 시). 누적된 exclude 도 함께 버린다.
     */
    public void cancel() {
        synchronized (lock) {
            if (scheduled != null) {
                scheduled.cancel(false);
                scheduled = null;
            }
            pendingExclude = new LinkedHashSet<>();
        }
    }

    void fire() {
        Set<T> exclude;
        synchronized (lock) {
            if (scheduled == null) {
                // cancel() 이후 늦게 실행된 타이머
                return;
            }
            scheduled = null;
            exclude = pendingExclude;
            pendingExclude = new LinkedHashSet<>();
        }

        try {
            flush.accept(Collections.unmodifiableSet(exclude));
        } catch (RuntimeException e) {
            logger.error("[presence] 브로드캐스트 실패: excludeCount={}", exclude.size(), e);
        }
    }
}

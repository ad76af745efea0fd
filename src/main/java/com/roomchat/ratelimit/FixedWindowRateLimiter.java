package com.roomchat.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @class FixedWindowRateLimiter
 * @brief key(사용자 ID, 클라이언트 IP 등)별 고정 윈도우 횟수 제한기. 추적 key 수에 hard limit 이 있다.
 *
 * @details
 * - entries 는 LRU 순서로 유지한다: 조회/기록된 key 는 항상 맨 뒤로 이동.
 *   그래서 만료된 윈도우는 앞쪽에 몰려 있고, 앞에서부터 정리하다 유효한 항목을 만나면 멈춘다.
 * - key 공간은 공격자가 늘릴 수 있으므로 maxTrackedKeys 는 메모리 상한이다.
 *   새 key 가 들어올 때 상한에 닿아 있으면 가장 오래된 항목부터 밀어낸다.
 * - 밀어내기는 공간 확보일 뿐, 지금 기록하려는 key 를 거부하지 않는다.
 * - 모든 public 메서드는 인스턴스 모니터로 직렬화된다.
 */
public class FixedWindowRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final String name;
    private final long windowMs;
    private final int maxCount;
    private final int maxTrackedKeys;

    private final LinkedHashMap<String, RateWindow> entries = new LinkedHashMap<>();

    public FixedWindowRateLimiter(String name, Duration window, int maxCount, int maxTrackedKeys) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window 는 양수여야 함: " + window);
        }
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount 는 1 이상이어야 함: " + maxCount);
        }
        if (maxTrackedKeys < 1) {
            throw new IllegalArgumentException("maxTrackedKeys 는 1 이상이어야 함: " + maxTrackedKeys);
        }
        this.name = name;
        this.windowMs = window.toMillis();
        this.maxCount = maxCount;
        this.maxTrackedKeys = maxTrackedKeys;
    }

    /**
     * @method check
     * @param key   제한 대상 key
     * @param nowMs 현재 시각(epoch ms)
     * @return allowed 또는 limited(retryAfterMs)
     */
    public synchronized RateLimitDecision check(String key, long nowMs) {
        pruneExpired(nowMs);

        RateWindow window = entries.get(key);
        if (window == null || nowMs - window.getWindowStartMs() >= windowMs) {
            touch(key, new RateWindow(nowMs, 1));
            return RateLimitDecision.allowed();
        }

        if (window.getCount() >= maxCount) {
            touch(key, window);
            long retryAfterMs = windowMs - (nowMs - window.getWindowStartMs());
            logger.debug("[rate-limit] {} 제한: retryAfterMs={}", name, retryAfterMs);
            return RateLimitDecision.limited(retryAfterMs);
        }

        touch(key, new RateWindow(window.getWindowStartMs(), window.getCount() + 1));
        return RateLimitDecision.allowed();
    }

    public synchronized int trackedKeyCount() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public String getName() {
        return name;
    }

    // 맨 뒤로 이동. 신규 key 이고 상한이면 앞에서부터 밀어낸다.
    private void touch(String key, RateWindow value) {
        if (entries.remove(key) == null) {
            evictEldestUntilBelow(maxTrackedKeys);
        }
        entries.put(key, value);
    }

    private void pruneExpired(long nowMs) {
        Iterator<Map.Entry<String, RateWindow>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            RateWindow window = it.next().getValue();
            if (nowMs - window.getWindowStartMs() < windowMs) {
                return;
            }
            it.remove();
        }
    }

    private void evictEldestUntilBelow(int limit) {
        Iterator<String> it = entries.keySet().iterator();
        int evicted = 0;
        while (entries.size() >= limit && it.hasNext()) {
            it.next();
            it.remove();
            evicted++;
        }
        if (evicted > 0) {
            logger.debug("[rate-limit] {} 추적 key 상한 도달 → {}개 제거", name, evicted);
        }
    }
}

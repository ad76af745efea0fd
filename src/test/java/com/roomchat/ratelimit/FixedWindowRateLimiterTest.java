package com.roomchat.ratelimit;

import com.roomchat.room.RoomConstants;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class FixedWindowRateLimiterTest {

    @Test
    public void limitsWithinWindowAndReportsRetryAfter() {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter("test", Duration.ofSeconds(10), 2, 100);

        assertTrue(limiter.check("u1", 1_000).isAllowed());
        assertTrue(limiter.check("u1", 2_000).isAllowed());

        RateLimitDecision limited = limiter.check("u1", 4_000);
        assertTrue(limited.isLimited());
        assertEquals(7_000, limited.getRetryAfterMs());

        // 다른 key 는 독립
        assertTrue(limiter.check("u2", 4_000).isAllowed());
    }

    @Test
    public void windowResetsAfterExpiry() {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter("test", Duration.ofMillis(100), 1, 100);

        assertTrue(limiter.check("k", 0).isAllowed());
        assertTrue(limiter.check("k", 50).isLimited());
        assertTrue(limiter.check("k", 100).isAllowed());
    }

    @Test
    public void trackedKeysAreBounded() {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter("test", Duration.ofMinutes(1), 1, 3);

        for (int i = 0; i < 10; i++) {
            limiter.check("key-" + i, 0);
        }
        assertTrue(limiter.trackedKeyCount() <= 3);

        // 가장 오래된 key 는 밀려났으므로 다시 허용된다
        assertTrue(limiter.check("key-0", 1).isAllowed());
        // 최근 key 는 아직 추적 중
        assertTrue(limiter.check("key-9", 1).isLimited());
    }

    @Test
    public void productionKeyCeilingHoldsAtTwentyThousand() {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter("message:global", Duration.ofSeconds(10), 1,
                RoomConstants.ROOM_RATE_LIMIT_MAX_TRACKED_KEYS);

        for (int i = 0; i < RoomConstants.ROOM_RATE_LIMIT_MAX_TRACKED_KEYS + 500; i++) {
            assertTrue(limiter.check("user-" + i, 0).isAllowed());
        }

        assertEquals(20_000, limiter.trackedKeyCount());
        assertTrue(limiter.check("user-0", 1).isAllowed());
        assertTrue(limiter.check("user-20499", 1).isLimited());
    }

    @Test
    public void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new FixedWindowRateLimiter("x", Duration.ZERO, 1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new FixedWindowRateLimiter("x", Duration.ofSeconds(1), 0, 1));
    }
}

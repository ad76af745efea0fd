package com.roomchat.ratelimit;

/**
 * @class RateLimitDecision
 * @brief check() 결과. limited 인 경우 다음 윈도우까지 남은 시간(retryAfterMs)을 함께 준다.
 */
public final class RateLimitDecision {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, 0L);

    private final boolean allowed;
    private final long retryAfterMs;

    private RateLimitDecision(boolean allowed, long retryAfterMs) {
        this.allowed = allowed;
        this.retryAfterMs = retryAfterMs;
    }

    public static RateLimitDecision allowed() {
        return ALLOWED;
    }

    public static RateLimitDecision limited(long retryAfterMs) {
        return new RateLimitDecision(false, Math.max(0L, retryAfterMs));
    }

    public boolean isAllowed() {
        return allowed;
    }

    public boolean isLimited() {
        return !allowed;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    @Override
    public String toString() {
        return allowed ? "allowed" : "limited(retryAfterMs=" + retryAfterMs + ")";
    }
}

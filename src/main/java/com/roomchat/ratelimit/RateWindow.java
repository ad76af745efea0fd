package com.roomchat.ratelimit;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 고정 윈도우 상태: 윈도우 시작 시각(ms) + 윈도우 내 누적 횟수
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class RateWindow {
    private final long windowStartMs;
    private final int count;
}

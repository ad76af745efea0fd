package com.roomchat.presence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class PresenceBroadcastCoalescerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> future;
    private List<Set<String>> flushed;
    private PresenceBroadcastCoalescer<String> coalescer;

    @BeforeEach
    public void setup() {
        taskScheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        flushed = new ArrayList<>();
        coalescer = new PresenceBroadcastCoalescer<>(Duration.ofMillis(200), taskScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC), flushed::add);
    }

    @Test
    public void burstOfRequestsSchedulesOneFlush() {
        coalescer.request();
        coalescer.request("c1");
        coalescer.request("c2");

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, times(1)).schedule(task.capture(), eq(NOW.plusMillis(200)));
        assertTrue(coalescer.isPending());

        task.getValue().run();

        assertEquals(1, flushed.size());
        assertEquals(Set.of("c1", "c2"), flushed.get(0));
        assertFalse(coalescer.isPending());
    }

    @Test
    public void requestAfterFlushStartsNewWindow() {
        coalescer.request("c1");
        coalescer.fire();
        coalescer.request();
        coalescer.fire();

        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
        assertEquals(2, flushed.size());
        assertTrue(flushed.get(1).isEmpty());
    }

    @Test
    public void cancelDropsPendingFlush() {
        coalescer.request("c1");
        coalescer.cancel();

        verify(future).cancel(false);
        coalescer.fire();
        assertTrue(flushed.isEmpty());
    }

    @Test
    public void flushFailureDoesNotBlockNextWindow() {
        PresenceBroadcastCoalescer<String> failing = new PresenceBroadcastCoalescer<>(Duration.ofMillis(200),
                taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC), exclude -> {
                    throw new IllegalStateException("boom");
                });

        failing.request();
        assertDoesNotThrow(failing::fire);
        failing.request();
        assertTrue(failing.isPending());
    }
}

package com.roomchat.room.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * @class OutboundQueue
 * @brief 연결 1개의 송신 대기열. 방 lock 안에서는 적재(offer)만 하고, 실제 소켓 쓰기는 lock 밖에서
 *        outbound executor 가 연결별로 1개 스레드씩 순서대로 처리한다.
 *
 * @details
 * - 같은 연결의 프레임은 적재 순서대로 나간다. drain 은 동시에 1개만 돈다 (draining 플래그).
 * - close 프레임이 적재된 뒤의 send 는 버린다. close 는 앞선 send 가 모두 나간 다음에 실행된다.
 * - 전송 실패(IOException, 닫힌 채널) 시 failed 로 전환하고 failureListener 에 연결 ID 를 알린다.
 *   대기 한도 초과는 offer 가 false 를 돌려주고 호출 측이 처리한다. failed 이후 send 는 버리고 close 만 실행한다.
 * - executor 가 작업을 거절하면 호출 스레드에서 바로 drain 한다.
 */
public final class OutboundQueue {

    private static final Logger logger = LoggerFactory.getLogger(OutboundQueue.class);

    private final ConnectionChannel channel;
    private final Executor executor;
    private final Consumer<String> failureListener;
    private final int maxPendingFrames;

    private final Queue<Frame> frames = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingSends = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();
    private volatile boolean closing;

    public OutboundQueue(ConnectionChannel channel, Executor executor,
                         Consumer<String> failureListener, int maxPendingFrames) {
        this.channel = channel;
        this.executor = executor;
        this.failureListener = failureListener;
        this.maxPendingFrames = maxPendingFrames;
    }

    /**
     * @return 적재했으면 true. 이미 닫히는 중이거나 실패했거나 대기 한도를 넘으면 false
     */
    public boolean offer(String payload) {
        if (closing || failed.get()) {
            return false;
        }
        if (pendingSends.incrementAndGet() > maxPendingFrames) {
            pendingSends.decrementAndGet();
            logger.warn("[송신 대기 초과] connectionId={}, max={}", channel.getId(), maxPendingFrames);
            failed.set(true);
            return false;
        }
        frames.add(Frame.send(payload));
        return true;
    }

    public void offerClose(int code, String reason) {
        if (closing) {
            return;
        }
        closing = true;
        frames.add(Frame.close(code, reason));
    }

    public boolean isFailed() {
        return failed.get();
    }

    public String getConnectionId() {
        return channel.getId();
    }

    /**
     * 적재된 프레임이 있으면 drain 을 예약한다. 방 lock 을 놓은 뒤에 호출한다.
     */
    public void flush() {
        if (frames.isEmpty() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            logger.warn("[송신 executor 거절] connectionId={} - 호출 스레드에서 처리", channel.getId());
            drain();
        }
    }

    private void drain() {
        while (true) {
            Frame frame;
            while ((frame = frames.poll()) != null) {
                if (frame.payload == null) {
                    channel.close(frame.closeCode, frame.closeReason);
                    continue;
                }
                pendingSends.decrementAndGet();
                if (!failed.get()) {
                    write(frame.payload);
                }
            }
            draining.set(false);
            // 플래그를 내린 사이에 적재된 프레임이 있으면 다시 잡는다
            if (frames.isEmpty() || !draining.compareAndSet(false, true)) {
                return;
            }
        }
    }

    private void write(String payload) {
        try {
            if (!channel.isOpen()) {
                throw new IOException("channel closed");
            }
            channel.send(payload);
        } catch (IOException | RuntimeException e) {
            logger.warn("[전송 실패] connectionId={}, error={}", channel.getId(), e.getMessage());
            if (failed.compareAndSet(false, true)) {
                failureListener.accept(channel.getId());
            }
        }
    }

    private static final class Frame {

        private final String payload;
        private final int closeCode;
        private final String closeReason;

        private Frame(String payload, int closeCode, String closeReason) {
            this.payload = payload;
            this.closeCode = closeCode;
            this.closeReason = closeReason;
        }

        static Frame send(String payload) {
            return new Frame(payload, 0, null);
        }

        static Frame close(int code, String reason) {
            return new Frame(null, code, reason);
        }
    }
}

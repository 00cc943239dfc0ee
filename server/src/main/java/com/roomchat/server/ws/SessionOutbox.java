package com.roomchat.server.ws;

import com.roomchat.server.model.ServerEvent;
import com.roomchat.server.room.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-session FIFO of outbound events:
 * - deliver only enqueues, one task at a time drains on the shared executor
 * - write error, overflow or a send over the time limit: give up, disconnect, close
 */
public class SessionOutbox implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(SessionOutbox.class);

    private final WebSocketSession session;
    private final EventCodec codec;
    private final Executor executor;
    private final int maxPending;
    private final long sendTimeLimitNanos;

    private final Queue<ServerEvent> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();

    // send in progress, guarded by sendLock
    private final Object sendLock = new Object();
    private Thread sender;
    private long sendStartedAt;

    private volatile Runnable onFailure = () -> { };

    public SessionOutbox(WebSocketSession session, EventCodec codec, Executor executor,
                         int maxPending, long sendTimeLimitMs) {
        if (maxPending <= 0) {
            throw new IllegalArgumentException("maxPending must be positive: " + maxPending);
        }
        if (sendTimeLimitMs <= 0) {
            throw new IllegalArgumentException("sendTimeLimitMs must be positive: " + sendTimeLimitMs);
        }
        this.session = session;
        this.codec = codec;
        this.executor = executor;
        this.maxPending = maxPending;
        this.sendTimeLimitNanos = TimeUnit.MILLISECONDS.toNanos(sendTimeLimitMs);
    }

    /**
     * Callback run once, on a worker thread, after the outbox gave up on the session.
     */
    public void onFailure(Runnable callback) {
        this.onFailure = callback;
    }

    @Override
    public void deliver(ServerEvent event) {
        if (failed.get() || checkSendTimeout()) {
            return;
        }
        if (pendingCount.incrementAndGet() > maxPending) {
            fail("outbox overflow (" + maxPending + " pending)", null);
            return;
        }
        pending.add(event);
        schedule();
    }

    /**
     * Fails the outbox and interrupts the writer if the current send is over the time limit.
     *
     * @return true if the outbox was failed by this call
     */
    public boolean checkSendTimeout() {
        synchronized (sendLock) {
            if (sender == null) {
                return false;
            }
            long elapsed = System.nanoTime() - sendStartedAt;
            if (elapsed <= sendTimeLimitNanos || failed.get()) {
                return false;
            }
            fail("send timed out after " + TimeUnit.NANOSECONDS.toMillis(elapsed) + " ms", null);
            sender.interrupt();
            return true;
        }
    }

    public boolean isFailed() {
        return failed.get();
    }

    public int pendingCount() {
        return Math.max(0, pendingCount.get());
    }

    private void schedule() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            fail("delivery rejected", e);
        }
    }

    private void drain() {
        try {
            ServerEvent event;
            while (!failed.get() && (event = pending.poll()) != null) {
                pendingCount.decrementAndGet();
                if (!send(event)) {
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        // an event may have been queued after the last poll but before draining was cleared
        if (!failed.get() && !pending.isEmpty()) {
            schedule();
        }
    }

    private boolean send(ServerEvent event) {
        synchronized (sendLock) {
            sender = Thread.currentThread();
            sendStartedAt = System.nanoTime();
        }
        try {
            session.sendMessage(codec.encode(event));
            return true;
        } catch (IOException | RuntimeException e) {
            fail("write failed", e);
            return false;
        } finally {
            synchronized (sendLock) {
                sender = null;
            }
        }
    }

    private void fail(String reason, Throwable cause) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        pending.clear();
        pendingCount.set(0);
        log.warn("[DROP] conn={} {}: {}", session.getId(), reason, cause == null ? "-" : cause.toString());

        // callback first: closing a stalled socket can block too
        Runnable teardown = () -> {
            try {
                onFailure.run();
            } finally {
                try {
                    session.close(CloseStatus.SESSION_NOT_RELIABLE);
                } catch (IOException e) {
                    log.debug("[DROP] conn={} close failed: {}", session.getId(), e.toString());
                }
            }
        };
        try {
            executor.execute(teardown);
        } catch (RejectedExecutionException e) {
            ForkJoinPool.commonPool().execute(teardown);
        }
    }
}

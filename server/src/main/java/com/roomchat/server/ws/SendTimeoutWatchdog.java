package com.roomchat.server.ws;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically gives up on sessions stuck in a single send, even when nothing new is delivered to them.
 */
@Component
public class SendTimeoutWatchdog {
    private static final Logger log = LoggerFactory.getLogger(SendTimeoutWatchdog.class);

    private final ChatHandler chatHandler;
    private final long checkIntervalMs;

    private ScheduledExecutorService scheduler;

    public SendTimeoutWatchdog(ChatHandler chatHandler,
                               @Value("${roomchat.outbox.check-interval-ms:250}") long checkIntervalMs) {
        if (checkIntervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be positive: " + checkIntervalMs);
        }
        this.chatHandler = chatHandler;
        this.checkIntervalMs = checkIntervalMs;
    }

    @PostConstruct
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "outbox-watchdog");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::sweep, checkIntervalMs, checkIntervalMs, TimeUnit.MILLISECONDS);
        log.info("[BOOT] send watchdog every {} ms", checkIntervalMs);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private void sweep() {
        try {
            int expired = chatHandler.expireStalledSends();
            if (expired > 0) {
                log.info("[DROP] {} stalled session(s) expired", expired);
            }
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("[ERROR] send watchdog sweep failed", e);
        }
    }
}

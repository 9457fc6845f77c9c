package com.partassist.session;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SessionReaper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    private final ScheduledExecutorService scheduler;

    public SessionReaper(SessionStore store, Duration interval) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "session-reaper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = Math.max(1L, interval.toMillis());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                store.evictIdle();
            } catch (RuntimeException e) {
                log.warn("Idle session eviction failed", e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}

package com.example.kitscanner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link SettleTimer} backed by a single daemon scheduler thread.
 */
public class ScheduledSettleTimer implements SettleTimer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledSettleTimer.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "scan-settle-timer");
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public Handle schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("Deferred scan callback failed", ex);
            }
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}

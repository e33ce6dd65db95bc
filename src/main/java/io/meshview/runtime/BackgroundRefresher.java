package io.meshview.runtime;

import io.meshview.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public final class BackgroundRefresher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundRefresher.class);

    private final SnapshotCache cache;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicLong completedTicks = new AtomicLong();
    private final AtomicLong failedTicks = new AtomicLong();

    public BackgroundRefresher(SnapshotCache cache, Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("refresh interval must be positive");
        }
        this.cache = cache;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "snapshot-background-refresher");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler.scheduleWithFixedDelay(this::tickSafe, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Background refresher started (interval={})", interval);
    }

    public void stop() {
        scheduler.shutdown();
        log.info("Background refresher stopped after {} ticks ({} failed)", completedTicks.get(), failedTicks.get());
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean running() {
        return started.get() && !scheduler.isShutdown();
    }

    public long completedTicks() {
        return completedTicks.get();
    }

    public long failedTicks() {
        return failedTicks.get();
    }

    @Override
    public void close() {
        stop();
    }

    void tickSafe() {
        try {
            Snapshot snapshot = cache.refresh().join();
            if (snapshot.stale()) {
                failedTicks.incrementAndGet();
                log.warn("Background refresh kept generation {} as stale: {}", snapshot.generation(), snapshot.staleReason());
            } else {
                log.debug("Background refresh produced generation {}", snapshot.generation());
            }
        } catch (CompletionException e) {
            failedTicks.incrementAndGet();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Background refresh failed: {}", cause.getMessage());
        } catch (RuntimeException e) {
            failedTicks.incrementAndGet();
            log.warn("Background refresh tick failed unexpectedly", e);
        } finally {
            completedTicks.incrementAndGet();
        }
    }
}

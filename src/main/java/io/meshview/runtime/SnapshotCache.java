package io.meshview.runtime;

import io.meshview.model.CacheState;
import io.meshview.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Last-good snapshot with TTL and single-flight refresh.
 *
 * <p>All slot transitions happen under {@link #lock}: installing the in-flight
 * future, committing a loaded snapshot, and falling back to stale data. Any number
 * of callers that miss while a refresh runs share that refresh's future, so they
 * cause exactly one {@link SnapshotLoader} cycle. A refresh that started before the
 * last {@link #invalidate()} is not joined; readers queue a successor load instead.
 *
 * <p>Failure policy: execution timeouts and failures get one retry after the
 * configured backoff; parse errors are not retried. After a failure the previous
 * snapshot is re-served marked stale; with no previous snapshot every waiter gets
 * {@link SnapshotUnavailableException}.
 */
public final class SnapshotCache {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCache.class);

    private final SnapshotLoader loader;
    private final Executor refreshExecutor;
    private final Clock clock;
    private final long ttlMs;
    private final long staleHoldMs;
    private final long retryBackoffMs;
    private final long watchdogMs;

    private final Object lock = new Object();
    private Snapshot snapshot;
    private long expiresAtMs = Long.MIN_VALUE;
    private CompletableFuture<Snapshot> inFlight;
    private long inFlightMark;
    private long generation;
    private long cycles;
    private long invalidations;

    public SnapshotCache(
            SnapshotLoader loader,
            Executor refreshExecutor,
            Clock clock,
            Duration ttl,
            Duration staleHold,
            Duration retryBackoff,
            Duration watchdog
    ) {
        if (loader == null || refreshExecutor == null || clock == null) {
            throw new IllegalArgumentException("loader, executor and clock are required");
        }
        if (ttl.isNegative() || staleHold.isNegative() || retryBackoff.isNegative()) {
            throw new IllegalArgumentException("cache durations cannot be negative");
        }
        if (watchdog.isNegative() || watchdog.isZero()) {
            throw new IllegalArgumentException("refresh watchdog must be positive");
        }
        this.loader = loader;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.ttlMs = ttl.toMillis();
        this.staleHoldMs = staleHold.toMillis();
        this.retryBackoffMs = retryBackoff.toMillis();
        this.watchdogMs = watchdog.toMillis();
    }

    public Snapshot getSnapshot() {
        return await(getSnapshotAsync());
    }

    public CompletableFuture<Snapshot> getSnapshotAsync() {
        return startOrJoin(false);
    }

    public CompletableFuture<Snapshot> refresh() {
        return startOrJoin(true);
    }

    public Snapshot refreshNow() {
        return await(refresh());
    }

    public void invalidate() {
        synchronized (lock) {
            invalidations++;
            expiresAtMs = Long.MIN_VALUE;
        }
        log.debug("Snapshot cache invalidated");
    }

    public CacheState state() {
        synchronized (lock) {
            if (inFlight != null) {
                return CacheState.REFRESHING;
            }
            if (snapshot == null) {
                return CacheState.EMPTY;
            }
            if (snapshot.stale() || clock.millis() > expiresAtMs) {
                return CacheState.STALE;
            }
            return CacheState.FRESH;
        }
    }

    public Optional<Snapshot> current() {
        synchronized (lock) {
            return Optional.ofNullable(snapshot);
        }
    }

    public long generation() {
        synchronized (lock) {
            return generation;
        }
    }

    private CompletableFuture<Snapshot> startOrJoin(boolean force) {
        CompletableFuture<Snapshot> promise;
        CompletableFuture<Snapshot> predecessor;
        long cycle;
        long invalidationMark;
        synchronized (lock) {
            if (!force && snapshot != null && clock.millis() <= expiresAtMs) {
                return CompletableFuture.completedFuture(snapshot);
            }
            if (inFlight != null && inFlightMark == invalidations) {
                return inFlight;
            }
            // A refresh started before the last invalidate() may hold pre-mutation
            // state; readers from now on wait for a successor load instead.
            predecessor = inFlight;
            promise = new CompletableFuture<>();
            inFlight = promise;
            inFlightMark = invalidations;
            cycle = ++cycles;
            invalidationMark = invalidations;
        }
        if (predecessor == null) {
            launch(promise, cycle, invalidationMark);
        } else {
            log.debug("Refresh cycle {} queued behind a refresh that predates invalidation", cycle);
            predecessor.handle((loaded, error) -> null)
                    .thenRun(() -> launch(promise, cycle, invalidationMark));
        }
        return promise;
    }

    private void launch(CompletableFuture<Snapshot> promise, long cycle, long invalidationMark) {
        CompletableFuture<Snapshot> work;
        try {
            work = CompletableFuture.supplyAsync(() -> loadWithRetry(cycle), refreshExecutor);
        } catch (RejectedExecutionException e) {
            work = CompletableFuture.failedFuture(e);
        }
        // Watchdog: REFRESHING is released even if the loader never returns; a late
        // result from an abandoned load is discarded.
        work.orTimeout(watchdogMs, TimeUnit.MILLISECONDS)
                .whenComplete((loaded, error) -> commit(promise, cycle, invalidationMark, loaded, error));
    }

    private Snapshot loadWithRetry(long cycle) {
        try {
            return loader.load(new RefreshAttempt(cycle, 1));
        } catch (SnapshotLoadException first) {
            if (!first.retryable()) {
                throw new CompletionException(first);
            }
            log.info("Refresh cycle {} attempt 1 failed ({}: {}); retrying in {} ms",
                    cycle, first.kind(), first.getMessage(), retryBackoffMs);
            try {
                Thread.sleep(retryBackoffMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(first);
            }
            try {
                return loader.load(new RefreshAttempt(cycle, 2));
            } catch (SnapshotLoadException second) {
                throw new CompletionException(second);
            }
        }
    }

    private void commit(
            CompletableFuture<Snapshot> promise,
            long cycle,
            long invalidationMark,
            Snapshot loaded,
            Throwable error
    ) {
        Throwable cause = unwrap(error);
        if (cause == null && loaded == null) {
            cause = new IllegalStateException("loader returned no snapshot");
        }
        Snapshot result = null;
        Snapshot previous;
        boolean invalidatedDuringLoad;
        synchronized (lock) {
            if (inFlight == promise) {
                inFlight = null;
            }
            previous = snapshot;
            invalidatedDuringLoad = invalidations != invalidationMark;
            long now = clock.millis();
            if (cause == null) {
                generation++;
                snapshot = loaded.withGeneration(generation);
                expiresAtMs = invalidatedDuringLoad ? Long.MIN_VALUE : now + ttlMs;
                result = snapshot;
            } else if (previous != null) {
                snapshot = previous.asStale(describe(cause));
                expiresAtMs = invalidatedDuringLoad ? Long.MIN_VALUE : now + staleHoldMs;
                result = snapshot;
            }
        }

        if (cause == null) {
            log.debug("Committed snapshot generation {} (cycle {}, {} peers, mode {})",
                    result.generation(), cycle, result.peers().size(), result.sourceMode().label());
            promise.complete(result);
            return;
        }
        logFailure(cycle, cause, previous != null);
        if (result != null) {
            promise.complete(result);
        } else {
            promise.completeExceptionally(new SnapshotUnavailableException(
                    "overlay state unavailable: " + describe(cause), cause));
        }
    }

    private void logFailure(long cycle, Throwable cause, boolean servingStale) {
        String outcome = servingStale ? "serving previous snapshot as stale" : "no previous snapshot to serve";
        if (cause instanceof SnapshotLoadException
                && ((SnapshotLoadException) cause).kind() == SnapshotLoadException.Kind.PARSE_ERROR) {
            log.error("Refresh cycle {} could not parse agent output, {}: {}", cycle, outcome, cause.getMessage());
            return;
        }
        log.warn("Refresh cycle {} failed, {}: {}", cycle, outcome, describe(cause));
    }

    private String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "refresh watchdog expired after " + watchdogMs + " ms";
        }
        if (cause instanceof SnapshotLoadException) {
            SnapshotLoadException load = (SnapshotLoadException) cause;
            return load.kind().name().toLowerCase(Locale.ROOT) + ": " + load.getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Snapshot await(CompletableFuture<Snapshot> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SnapshotUnavailableException("overlay state unavailable: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new SnapshotUnavailableException("refresh was cancelled", e);
        }
    }
}

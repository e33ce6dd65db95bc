package io.meshview.runtime;

import io.meshview.model.CacheState;
import io.meshview.model.Snapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class SnapshotCacheTest {
    private static final Duration TTL = Duration.ofSeconds(5);

    private final ExecutorService refreshExecutor = Executors.newCachedThreadPool();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-18T10:00:00Z"));

    @AfterEach
    void shutdown() {
        refreshExecutor.shutdownNow();
    }

    @Test
    void concurrentMissesShareOneLoad() throws Exception {
        ScriptedLoader loader = new ScriptedLoader().gated();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        ExecutorService readers = Executors.newFixedThreadPool(16);
        try {
            List<Future<Snapshot>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                results.add(readers.submit(cache::getSnapshot));
            }
            Assertions.assertTrue(loader.awaitEntered());
            Assertions.assertEquals(CacheState.REFRESHING, cache.state());
            Thread.sleep(100L);
            loader.release();

            for (Future<Snapshot> result : results) {
                Assertions.assertEquals(1L, result.get(5, TimeUnit.SECONDS).generation());
            }
            Assertions.assertEquals(1, loader.calls());
            Assertions.assertEquals(CacheState.FRESH, cache.state());
        } finally {
            loader.release();
            readers.shutdownNow();
        }
    }

    @Test
    void concurrentReadsOfAnExpiredSlotShareOneLoad() throws Exception {
        ScriptedLoader loader = new ScriptedLoader();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        Snapshot first = cache.getSnapshot();
        clock.advance(Duration.ofSeconds(6));
        Assertions.assertEquals(CacheState.STALE, cache.state());

        loader.gated();
        ExecutorService readers = Executors.newFixedThreadPool(8);
        try {
            List<Future<Snapshot>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(readers.submit(cache::getSnapshot));
            }
            Assertions.assertTrue(loader.awaitEntered());
            Thread.sleep(100L);
            loader.release();

            for (Future<Snapshot> result : results) {
                Snapshot snapshot = result.get(5, TimeUnit.SECONDS);
                Assertions.assertEquals(first.generation() + 1, snapshot.generation());
                Assertions.assertFalse(snapshot.stale());
            }
            Assertions.assertEquals(2, loader.calls());
        } finally {
            loader.release();
            readers.shutdownNow();
        }
    }

    @Test
    void coldReadsShareOneGenerationAndALaterReadAfterTtlGetsTheNext() throws Exception {
        ScriptedLoader loader = new ScriptedLoader().gated();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        ExecutorService readers = Executors.newFixedThreadPool(3);
        try {
            List<Future<Snapshot>> results = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                results.add(readers.submit(cache::getSnapshot));
            }
            Assertions.assertTrue(loader.awaitEntered());
            Thread.sleep(100L);
            loader.release();

            long generation = results.get(0).get(5, TimeUnit.SECONDS).generation();
            for (Future<Snapshot> result : results) {
                Assertions.assertEquals(generation, result.get(5, TimeUnit.SECONDS).generation());
            }
            Assertions.assertEquals(1, loader.calls());

            clock.advance(Duration.ofSeconds(6));
            Assertions.assertEquals(generation + 1, cache.getSnapshot().generation());
            Assertions.assertEquals(2, loader.calls());
        } finally {
            loader.release();
            readers.shutdownNow();
        }
    }

    @Test
    void freshSnapshotIsServedWithoutLoadingUntilTtlExpires() {
        ScriptedLoader loader = new ScriptedLoader();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));

        Snapshot first = cache.getSnapshot();
        clock.advance(Duration.ofMillis(4_900));
        Assertions.assertSame(first, cache.getSnapshot());
        Assertions.assertEquals(CacheState.FRESH, cache.state());
        Assertions.assertEquals(1, loader.calls());

        clock.advance(Duration.ofMillis(200));
        Assertions.assertEquals(CacheState.STALE, cache.state());
        Snapshot second = cache.getSnapshot();
        Assertions.assertEquals(2, loader.calls());
        Assertions.assertEquals(2L, second.generation());
        Assertions.assertFalse(second.stale());
    }

    @Test
    void generationsIncreaseStrictlyAcrossCommits() {
        ScriptedLoader loader = new ScriptedLoader();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));

        long previous = 0L;
        for (int i = 0; i < 5; i++) {
            long generation = cache.refreshNow().generation();
            Assertions.assertTrue(generation > previous, "generation " + generation + " after " + previous);
            previous = generation;
        }
        Assertions.assertEquals(5L, cache.generation());
    }

    @Test
    void executionFailureIsRetriedOnceWithinTheSameCycle() {
        ScriptedLoader loader = new ScriptedLoader()
                .thenFail(SnapshotLoadException.Kind.EXECUTION_TIMEOUT)
                .thenSucceed(3);
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));

        Snapshot snapshot = cache.getSnapshot();

        Assertions.assertFalse(snapshot.stale());
        Assertions.assertEquals(1L, snapshot.generation());
        Assertions.assertEquals(3, snapshot.peers().size());
        Assertions.assertEquals(List.of(new RefreshAttempt(1L, 1), new RefreshAttempt(1L, 2)), loader.attempts());
    }

    @Test
    void twoFailuresServePreviousSnapshotAsStaleAndHoldIt() {
        ScriptedLoader loader = new ScriptedLoader()
                .thenSucceed(2)
                .alwaysFail(SnapshotLoadException.Kind.EXECUTION_FAILURE);
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        Snapshot good = cache.getSnapshot();

        clock.advance(Duration.ofSeconds(6));
        Snapshot stale = cache.getSnapshot();

        Assertions.assertTrue(stale.stale());
        Assertions.assertTrue(stale.staleReason().contains("execution_failure"), stale.staleReason());
        Assertions.assertEquals(good.generation(), stale.generation());
        Assertions.assertEquals(good.peers(), stale.peers());
        Assertions.assertEquals(good.self(), stale.self());
        Assertions.assertEquals(3, loader.calls());
        Assertions.assertEquals(CacheState.STALE, cache.state());
        Assertions.assertTrue(cache.current().orElseThrow().stale());

        Assertions.assertSame(stale, cache.getSnapshot());
        Assertions.assertEquals(3, loader.calls());

        clock.advance(Duration.ofMillis(5_001));
        cache.getSnapshot();
        Assertions.assertEquals(5, loader.calls());
    }

    @Test
    void coldStartFailureReachesTheReaderAndLeavesTheSlotEmpty() {
        ScriptedLoader loader = new ScriptedLoader().alwaysFail(SnapshotLoadException.Kind.EXECUTION_TIMEOUT);
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));

        SnapshotUnavailableException e = Assertions.assertThrows(SnapshotUnavailableException.class, cache::getSnapshot);

        Assertions.assertTrue(e.getMessage().contains("execution_timeout"), e.getMessage());
        Assertions.assertEquals(2, loader.calls());
        Assertions.assertEquals(CacheState.EMPTY, cache.state());
        Assertions.assertTrue(cache.current().isEmpty());
        Assertions.assertEquals(0L, cache.generation());

        Assertions.assertThrows(SnapshotUnavailableException.class, cache::getSnapshot);
        Assertions.assertEquals(4, loader.calls());
    }

    @Test
    void parseErrorIsNotRetried() {
        ScriptedLoader loader = new ScriptedLoader().thenFail(SnapshotLoadException.Kind.PARSE_ERROR);
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));

        SnapshotUnavailableException e = Assertions.assertThrows(SnapshotUnavailableException.class, cache::getSnapshot);
        Assertions.assertTrue(e.getMessage().contains("parse_error"), e.getMessage());
        Assertions.assertEquals(1, loader.calls());

        Assertions.assertEquals(1L, cache.getSnapshot().generation());
        Assertions.assertEquals(2, loader.calls());
    }

    @Test
    void invalidateForcesTheNextReadToLoad() {
        ScriptedLoader loader = new ScriptedLoader();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        cache.getSnapshot();

        cache.invalidate();

        Assertions.assertEquals(CacheState.STALE, cache.state());
        Assertions.assertEquals(2L, cache.getSnapshot().generation());
        Assertions.assertEquals(2, loader.calls());
    }

    @Test
    void refreshInFlightDuringInvalidateCommitsAsExpired() throws Exception {
        ScriptedLoader loader = new ScriptedLoader().gated();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        try {
            CompletableFuture<Snapshot> pending = cache.getSnapshotAsync();
            Assertions.assertTrue(loader.awaitEntered());

            cache.invalidate();
            loader.release();

            Assertions.assertEquals(1L, pending.get(5, TimeUnit.SECONDS).generation());
            Assertions.assertEquals(CacheState.STALE, cache.state());
            Assertions.assertEquals(2L, cache.getSnapshot().generation());
            Assertions.assertEquals(2, loader.calls());
        } finally {
            loader.release();
        }
    }

    @Test
    void readAfterInvalidateDoesNotJoinARefreshThatStartedBeforeIt() throws Exception {
        ScriptedLoader loader = new ScriptedLoader().gated().thenSucceed(1).thenSucceed(4);
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        try {
            CompletableFuture<Snapshot> beforeWrite = cache.getSnapshotAsync();
            Assertions.assertTrue(loader.awaitEntered());

            cache.invalidate();
            CompletableFuture<Snapshot> afterWrite = cache.getSnapshotAsync();
            Assertions.assertNotSame(beforeWrite, afterWrite);
            Assertions.assertSame(afterWrite, cache.getSnapshotAsync());
            Assertions.assertEquals(CacheState.REFRESHING, cache.state());

            loader.release();
            Assertions.assertEquals(1L, beforeWrite.get(5, TimeUnit.SECONDS).generation());
            Snapshot reflected = afterWrite.get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(2L, reflected.generation());
            Assertions.assertEquals(4, reflected.peers().size());
            Assertions.assertEquals(2, loader.calls());
            Assertions.assertEquals(CacheState.FRESH, cache.state());
        } finally {
            loader.release();
        }
    }

    @Test
    void refreshJoinsInFlightWorkAndForcesLoadWhenFresh() throws Exception {
        ScriptedLoader loader = new ScriptedLoader().gated();
        SnapshotCache cache = cache(loader, Duration.ofSeconds(5));
        try {
            CompletableFuture<Snapshot> first = cache.getSnapshotAsync();
            Assertions.assertTrue(loader.awaitEntered());
            Assertions.assertSame(first, cache.refresh());
            Assertions.assertSame(first, cache.getSnapshotAsync());
            loader.release();
            Assertions.assertEquals(1L, first.get(5, TimeUnit.SECONDS).generation());
        } finally {
            loader.release();
        }

        Assertions.assertEquals(CacheState.FRESH, cache.state());
        Assertions.assertEquals(2L, cache.refresh().get(5, TimeUnit.SECONDS).generation());
        Assertions.assertEquals(2, loader.calls());
    }

    @Test
    void watchdogReleasesAHungRefresh() {
        ScriptedLoader loader = new ScriptedLoader().gated();
        SnapshotCache cache = cache(loader, Duration.ofMillis(200));
        try {
            SnapshotUnavailableException e = Assertions.assertThrows(SnapshotUnavailableException.class, cache::getSnapshot);
            Assertions.assertTrue(e.getMessage().contains("watchdog"), e.getMessage());
            Assertions.assertEquals(CacheState.EMPTY, cache.state());
        } finally {
            loader.release();
        }
    }

    @Test
    void invalidDurationsAreRejected() {
        ScriptedLoader loader = new ScriptedLoader();
        Assertions.assertThrows(IllegalArgumentException.class, () -> cache(loader, Duration.ZERO));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new SnapshotCache(
                loader, refreshExecutor, clock, Duration.ofSeconds(-1), TTL, Duration.ZERO, Duration.ofSeconds(1)));
    }

    private SnapshotCache cache(ScriptedLoader loader, Duration watchdog) {
        return new SnapshotCache(loader, refreshExecutor, clock, TTL, TTL, Duration.ofMillis(10), watchdog);
    }
}

package io.meshview.runtime;

import io.meshview.agent.AgentCommandExecutor;
import io.meshview.config.MeshViewSettings;
import io.meshview.model.CacheState;
import io.meshview.model.Snapshot;
import io.meshview.parse.StatusNormalizer;
import io.meshview.parse.StatusParser;
import io.meshview.remote.RemoteApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class MeshViewRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MeshViewRuntime.class);
    private static final AtomicInteger REFRESH_THREAD_SEQ = new AtomicInteger();

    private final MeshViewSettings settings;
    private final ExecutorService refreshExecutor;
    private final SnapshotCache cache;
    private final BackgroundRefresher refresher;

    public MeshViewRuntime(MeshViewSettings settings) {
        this(settings, agentLoader(settings), Clock.systemUTC());
    }

    public MeshViewRuntime(MeshViewSettings settings, SnapshotLoader loader, Clock clock) {
        this.settings = settings;
        this.refreshExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "snapshot-refresh-" + REFRESH_THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.cache = new SnapshotCache(
                loader,
                refreshExecutor,
                clock,
                settings.cacheTtl(),
                settings.staleHold(),
                settings.retryBackoff(),
                settings.refreshWatchdog()
        );
        this.refresher = new BackgroundRefresher(cache, settings.refreshInterval());
    }

    static SnapshotLoader agentLoader(MeshViewSettings settings) {
        AgentCommandExecutor executor = AgentCommandExecutor.locate(settings.agentBinary());
        RemoteApiClient remote = settings.remoteConfigured()
                ? new RemoteApiClient(
                        settings.remoteApiBaseUrl(),
                        settings.remoteTailnet(),
                        settings.remoteApiKey(),
                        settings.remoteCheckTimeout(),
                        settings.remoteRequestTimeout())
                : null;
        log.info("Agent binary {}; remote API {}", executor.binary(), remote == null ? "not configured" : "configured");
        return new AgentSnapshotLoader(
                executor,
                settings.statusTimeout(),
                new StatusParser(),
                new StatusNormalizer(),
                new ModeArbiter(remote),
                remote
        );
    }

    public MeshViewSettings settings() {
        return settings;
    }

    public SnapshotCache cache() {
        return cache;
    }

    public Snapshot snapshot() {
        return cache.getSnapshot();
    }

    public Snapshot liveSnapshot() {
        return cache.refreshNow();
    }

    public void invalidate() {
        cache.invalidate();
    }

    public CacheState state() {
        return cache.state();
    }

    public void startBackgroundRefresh() {
        refresher.start();
    }

    public BackgroundRefresher refresher() {
        return refresher;
    }

    @Override
    public void close() {
        refresher.stop();
        refreshExecutor.shutdown();
        try {
            Duration grace = settings.refreshWatchdog();
            if (!refreshExecutor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Refresh threads still busy {} after shutdown; leaving them to the watchdog", grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

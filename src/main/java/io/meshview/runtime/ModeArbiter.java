package io.meshview.runtime;

import io.meshview.model.SourceMode;
import io.meshview.remote.RemoteApiClient;
import io.meshview.remote.RemoteApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ModeArbiter {
    private static final Logger log = LoggerFactory.getLogger(ModeArbiter.class);

    private final RemoteApiClient remote;
    private final Object lock = new Object();
    private long decidedCycle = -1L;
    private SourceMode decidedMode = SourceMode.LOCAL_ONLY;

    public ModeArbiter(RemoteApiClient remote) {
        this.remote = remote;
    }

    public SourceMode modeFor(long cycle) {
        synchronized (lock) {
            if (cycle == decidedCycle) {
                return decidedMode;
            }
        }
        SourceMode mode = selectMode();
        synchronized (lock) {
            decidedCycle = cycle;
            decidedMode = mode;
        }
        return mode;
    }

    public SourceMode selectMode() {
        if (remote == null || !remote.configured()) {
            return SourceMode.LOCAL_ONLY;
        }
        try {
            remote.checkReachable();
            return SourceMode.AUGMENTED;
        } catch (RemoteApiException e) {
            log.warn("Remote API {} during the reachability check, using local-only data this cycle: {}", e.kind(), e.getMessage());
            return SourceMode.LOCAL_ONLY;
        }
    }
}

package io.meshview.runtime;

import io.meshview.model.Snapshot;

public interface SnapshotLoader {
    Snapshot load(RefreshAttempt attempt) throws SnapshotLoadException;
}

package io.meshview.runtime;

public final class SnapshotUnavailableException extends RuntimeException {
    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

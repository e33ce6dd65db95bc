package io.meshview.runtime;

public final class SnapshotLoadException extends Exception {
    public enum Kind {
        EXECUTION_TIMEOUT(true),
        EXECUTION_FAILURE(true),
        PARSE_ERROR(false);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    private final Kind kind;

    public SnapshotLoadException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SnapshotLoadException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind.retryable();
    }
}

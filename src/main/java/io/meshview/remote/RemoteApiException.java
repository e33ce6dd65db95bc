package io.meshview.remote;

public final class RemoteApiException extends Exception {
    public enum Kind {
        UNAVAILABLE,
        UNAUTHORIZED
    }

    private final Kind kind;

    public RemoteApiException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RemoteApiException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}

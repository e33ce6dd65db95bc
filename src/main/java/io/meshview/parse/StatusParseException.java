package io.meshview.parse;

public final class StatusParseException extends Exception {
    public StatusParseException(String message) {
        super(message);
    }

    public StatusParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

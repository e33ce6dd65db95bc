package io.meshview.runtime;

public record RefreshAttempt(long cycle, int attempt) {
}

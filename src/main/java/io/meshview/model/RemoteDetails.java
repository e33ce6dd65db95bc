package io.meshview.model;

import java.time.Instant;

public record RemoteDetails(
        boolean authorized,
        String clientVersion,
        boolean updateAvailable,
        Instant keyExpiry,
        String user
) {
}

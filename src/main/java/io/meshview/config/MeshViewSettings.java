package io.meshview.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshview.security.SensitiveDataMasker;
import io.meshview.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public record MeshViewSettings(
        String agentBinary,
        long statusTimeoutMs,
        long cacheTtlMs,
        long staleHoldMs,
        long retryBackoffMs,
        long refreshIntervalMs,
        long refreshWatchdogMs,
        String remoteApiBaseUrl,
        String remoteTailnet,
        String remoteApiKey,
        long remoteCheckTimeoutMs,
        long remoteRequestTimeoutMs
) {
    private static final Logger log = LoggerFactory.getLogger(MeshViewSettings.class);

    public static MeshViewSettings defaults() {
        return fromFile(null, Map.of());
    }

    public static MeshViewSettings load(MeshViewConfig config, Map<String, String> env) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            log.debug("No settings file at {}, using defaults", file);
            return fromFile(null, env);
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            log.debug("Loaded settings from {}", file);
            return fromFile(parsed, env);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load settings: " + file, e);
        }
    }

    static MeshViewSettings fromFile(SettingsFile file, Map<String, String> env) {
        SettingsFile f = file == null ? SettingsFile.EMPTY : file;
        Map<String, String> e = env == null ? Map.of() : env;

        long statusTimeout = sanitizeLong(f.statusTimeoutMs(), MeshViewConfig.DEFAULT_STATUS_TIMEOUT_MS, 100L);
        long ttl = sanitizeLong(f.cacheTtlMs(), MeshViewConfig.DEFAULT_CACHE_TTL_MS, 0L);
        long staleHold = sanitizeLong(f.staleHoldMs(), ttl, 0L);
        long backoff = sanitizeLong(f.retryBackoffMs(), MeshViewConfig.DEFAULT_RETRY_BACKOFF_MS, 0L);
        long interval = sanitizeLong(
                f.refreshIntervalMs(),
                Math.max(MeshViewConfig.MIN_REFRESH_INTERVAL_MS, ttl - 1_000L),
                MeshViewConfig.MIN_REFRESH_INTERVAL_MS
        );

        String apiKey = firstNonBlank(e.get(MeshViewConfig.ENV_API_KEY), f.remoteApiKey(), "");
        String tailnet = firstNonBlank(e.get(MeshViewConfig.ENV_TAILNET), f.remoteTailnet(), MeshViewConfig.DEFAULT_TAILNET);
        String baseUrl = firstNonBlank(f.remoteApiBaseUrl(), MeshViewConfig.DEFAULT_REMOTE_API_BASE_URL);
        long checkTimeout = sanitizeLong(f.remoteCheckTimeoutMs(), MeshViewConfig.DEFAULT_REMOTE_CHECK_TIMEOUT_MS, 100L);
        long requestTimeout = sanitizeLong(
                envSecondsAsMs(e.get(MeshViewConfig.ENV_API_TIMEOUT_SECONDS), f.remoteRequestTimeoutMs()),
                MeshViewConfig.DEFAULT_REMOTE_REQUEST_TIMEOUT_MS,
                100L
        );

        // Two agent runs, the retry backoff and both remote calls must fit inside one watchdog window.
        long minimumWatchdog = 2L * statusTimeout + backoff + checkTimeout + requestTimeout;
        long watchdog = sanitizeLong(f.refreshWatchdogMs(), minimumWatchdog + 1_000L, statusTimeout);

        return new MeshViewSettings(
                firstNonBlank(f.agentBinary(), ""),
                statusTimeout,
                ttl,
                staleHold,
                backoff,
                interval,
                watchdog,
                baseUrl,
                tailnet,
                apiKey,
                checkTimeout,
                requestTimeout
        );
    }

    public boolean remoteConfigured() {
        return remoteApiKey != null && !remoteApiKey.isBlank();
    }

    public Duration statusTimeout() {
        return Duration.ofMillis(statusTimeoutMs);
    }

    public Duration cacheTtl() {
        return Duration.ofMillis(cacheTtlMs);
    }

    public Duration staleHold() {
        return Duration.ofMillis(staleHoldMs);
    }

    public Duration retryBackoff() {
        return Duration.ofMillis(retryBackoffMs);
    }

    public Duration refreshInterval() {
        return Duration.ofMillis(refreshIntervalMs);
    }

    public Duration refreshWatchdog() {
        return Duration.ofMillis(refreshWatchdogMs);
    }

    public Duration remoteCheckTimeout() {
        return Duration.ofMillis(remoteCheckTimeoutMs);
    }

    public Duration remoteRequestTimeout() {
        return Duration.ofMillis(remoteRequestTimeoutMs);
    }

    public JsonNode toView() {
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(this));
    }

    @Override
    public String toString() {
        return toView().toString();
    }

    private static Long envSecondsAsMs(String rawSeconds, Long fallbackMs) {
        if (rawSeconds == null || rawSeconds.isBlank()) {
            return fallbackMs;
        }
        try {
            return Long.parseLong(rawSeconds.trim()) * 1_000L;
        } catch (NumberFormatException ex) {
            log.warn("Ignoring non-numeric {}={}", MeshViewConfig.ENV_API_TIMEOUT_SECONDS, rawSeconds);
            return fallbackMs;
        }
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    record SettingsFile(
            String agentBinary,
            Long statusTimeoutMs,
            Long cacheTtlMs,
            Long staleHoldMs,
            Long retryBackoffMs,
            Long refreshIntervalMs,
            Long refreshWatchdogMs,
            String remoteApiBaseUrl,
            String remoteTailnet,
            String remoteApiKey,
            Long remoteCheckTimeoutMs,
            Long remoteRequestTimeoutMs
    ) {
        static final SettingsFile EMPTY = new SettingsFile(
                null, null, null, null, null, null, null, null, null, null, null, null
        );
    }
}

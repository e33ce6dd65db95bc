package io.meshview.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MeshViewConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "meshview-settings.json";

    public static final long DEFAULT_STATUS_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_CACHE_TTL_MS = 5_000L;
    public static final long DEFAULT_RETRY_BACKOFF_MS = 500L;
    public static final long MIN_REFRESH_INTERVAL_MS = 1_000L;
    public static final String DEFAULT_REMOTE_API_BASE_URL = "https://api.tailscale.com/api/v2";
    public static final String DEFAULT_TAILNET = "-";
    public static final long DEFAULT_REMOTE_CHECK_TIMEOUT_MS = 2_000L;
    public static final long DEFAULT_REMOTE_REQUEST_TIMEOUT_MS = 5_000L;

    public static final String ENV_API_KEY = "TAILSCALE_API_KEY";
    public static final String ENV_TAILNET = "TAILSCALE_TAILNET";
    public static final String ENV_API_TIMEOUT_SECONDS = "TAILSCALE_API_TIMEOUT";

    private final Path rootDir;

    public MeshViewConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static MeshViewConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new MeshViewConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}

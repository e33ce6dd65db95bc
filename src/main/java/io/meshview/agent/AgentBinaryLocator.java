package io.meshview.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

public final class AgentBinaryLocator {
    private static final Logger log = LoggerFactory.getLogger(AgentBinaryLocator.class);

    public static final String DEFAULT_BINARY = "tailscale";
    public static final String DEFAULT_WINDOWS_BINARY = "tailscale.exe";

    private static final List<String> LINUX_CANDIDATES = List.of(
            "/usr/bin/tailscale",
            "/usr/sbin/tailscale",
            "/usr/local/bin/tailscale"
    );
    private static final List<String> MAC_CANDIDATES = List.of(
            "/Applications/Tailscale.app/Contents/MacOS/Tailscale",
            "/usr/local/bin/tailscale",
            "/opt/homebrew/bin/tailscale"
    );
    private static final List<String> WINDOWS_CANDIDATES = List.of(
            "C:\\Program Files\\Tailscale\\tailscale.exe"
    );

    private final String osName;
    private final String pathEnv;
    private final Predicate<Path> executable;

    public AgentBinaryLocator(String osName, String pathEnv, Predicate<Path> executable) {
        this.osName = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        this.pathEnv = pathEnv == null ? "" : pathEnv;
        this.executable = executable;
    }

    public static AgentBinaryLocator system() {
        return new AgentBinaryLocator(System.getProperty("os.name"), System.getenv("PATH"), Files::isExecutable);
    }

    public String resolve(String override) {
        if (override != null && !override.isBlank()) {
            log.debug("Using configured agent binary {}", override.trim());
            return override.trim();
        }
        List<String> candidates = new ArrayList<>(platformCandidates());
        String binaryName = windows() ? DEFAULT_WINDOWS_BINARY : DEFAULT_BINARY;
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (!dir.isBlank()) {
                candidates.add(dir + File.separator + binaryName);
            }
        }
        for (String candidate : candidates) {
            if (isExecutable(candidate)) {
                log.debug("Resolved agent binary {}", candidate);
                return candidate;
            }
        }
        log.warn("Agent binary not found in known locations or PATH; falling back to '{}'", binaryName);
        return binaryName;
    }

    private List<String> platformCandidates() {
        if (windows()) {
            return WINDOWS_CANDIDATES;
        }
        if (osName.contains("mac") || osName.contains("darwin")) {
            return MAC_CANDIDATES;
        }
        return LINUX_CANDIDATES;
    }

    private boolean windows() {
        return osName.startsWith("windows");
    }

    private boolean isExecutable(String candidate) {
        try {
            return executable.test(Path.of(candidate));
        } catch (InvalidPathException e) {
            log.debug("Skipping unusable agent path candidate {}: {}", candidate, e.getMessage());
            return false;
        }
    }
}

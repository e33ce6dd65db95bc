package io.meshview.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

public final class AgentCommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(AgentCommandExecutor.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final long STREAM_GRACE_MS = 1_000L;
    private static final AtomicInteger READER_SEQ = new AtomicInteger();
    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-stream-reader-" + READER_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final String binary;

    public AgentCommandExecutor(String binary) {
        if (binary == null || binary.isBlank()) {
            throw new IllegalArgumentException("agent binary cannot be empty");
        }
        this.binary = binary;
    }

    public static AgentCommandExecutor locate(String override) {
        return new AgentCommandExecutor(AgentBinaryLocator.system().resolve(override));
    }

    public String binary() {
        return binary;
    }

    public ExecutionResult run(List<String> args, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("agent timeout must be positive");
        }
        List<String> command = new ArrayList<>();
        command.add(binary);
        if (args != null) {
            command.addAll(args);
        }
        log.debug("Running agent command {}", command);
        ProcessBuilder pb = new ProcessBuilder(command);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return new ExecutionResult.Failure(-1, truncate("agent spawn failed: " + e.getMessage()));
        }

        CompletableFuture<byte[]> stdout = drain(process.getInputStream());
        CompletableFuture<byte[]> stderr = drain(process.getErrorStream());
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                kill(process);
                log.debug("Agent command {} killed after {}", command, timeout);
                return new ExecutionResult.Timeout(timeout);
            }
            byte[] out = stdout.get(STREAM_GRACE_MS, TimeUnit.MILLISECONDS);
            byte[] err = stderr.get(STREAM_GRACE_MS, TimeUnit.MILLISECONDS);
            int exit = process.exitValue();
            if (exit == 0) {
                return new ExecutionResult.Success(out);
            }
            return new ExecutionResult.Failure(exit, truncate(new String(err, StandardCharsets.UTF_8)));
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            return new ExecutionResult.Failure(-1, "agent run interrupted");
        } catch (TimeoutException e) {
            // The process exited but something it spawned still holds the pipes open.
            kill(process);
            return new ExecutionResult.Timeout(timeout);
        } catch (IOException | ExecutionException e) {
            kill(process);
            return new ExecutionResult.Failure(-1, truncate("agent execution failed: " + e.getMessage()));
        }
    }

    private static CompletableFuture<byte[]> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read agent output", e);
            }
        }, STREAM_READERS);
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}

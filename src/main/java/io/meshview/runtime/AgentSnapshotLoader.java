package io.meshview.runtime;

import io.meshview.agent.AgentCommandExecutor;
import io.meshview.agent.ExecutionResult;
import io.meshview.model.Snapshot;
import io.meshview.model.SourceMode;
import io.meshview.parse.RawStatus;
import io.meshview.parse.StatusNormalizer;
import io.meshview.parse.StatusParseException;
import io.meshview.parse.StatusParser;
import io.meshview.remote.RemoteApiClient;

import java.time.Duration;
import java.util.List;

public final class AgentSnapshotLoader implements SnapshotLoader {
    static final List<String> STATUS_ARGS = List.of("status", "--json");

    private final AgentCommandExecutor executor;
    private final Duration statusTimeout;
    private final StatusParser parser;
    private final StatusNormalizer normalizer;
    private final ModeArbiter arbiter;
    private final RemoteApiClient remote;

    public AgentSnapshotLoader(
            AgentCommandExecutor executor,
            Duration statusTimeout,
            StatusParser parser,
            StatusNormalizer normalizer,
            ModeArbiter arbiter,
            RemoteApiClient remote
    ) {
        this.executor = executor;
        this.statusTimeout = statusTimeout;
        this.parser = parser;
        this.normalizer = normalizer;
        this.arbiter = arbiter;
        this.remote = remote;
    }

    @Override
    public Snapshot load(RefreshAttempt attempt) throws SnapshotLoadException {
        SourceMode mode = arbiter.modeFor(attempt.cycle());
        ExecutionResult result = executor.run(STATUS_ARGS, statusTimeout);
        if (result instanceof ExecutionResult.Timeout) {
            throw new SnapshotLoadException(SnapshotLoadException.Kind.EXECUTION_TIMEOUT, result.describe());
        }
        if (!(result instanceof ExecutionResult.Success)) {
            throw new SnapshotLoadException(SnapshotLoadException.Kind.EXECUTION_FAILURE, result.describe());
        }
        RawStatus raw;
        try {
            raw = parser.parse(((ExecutionResult.Success) result).stdout());
        } catch (StatusParseException e) {
            throw new SnapshotLoadException(SnapshotLoadException.Kind.PARSE_ERROR, e.getMessage(), e);
        }
        Snapshot local = normalizer.normalize(raw);
        if (mode == SourceMode.AUGMENTED && remote != null) {
            return remote.augment(local);
        }
        return local;
    }
}

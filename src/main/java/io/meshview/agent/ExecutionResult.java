package io.meshview.agent;

import java.time.Duration;

public interface ExecutionResult {

    String describe();

    record Success(byte[] stdout) implements ExecutionResult {
        public Success {
            stdout = stdout == null ? new byte[0] : stdout;
        }

        @Override
        public String describe() {
            return "ok (" + stdout.length + " bytes)";
        }
    }

    record Timeout(Duration after) implements ExecutionResult {
        @Override
        public String describe() {
            return "agent timeout after " + after;
        }
    }

    record Failure(int exitCode, String stderr) implements ExecutionResult {
        @Override
        public String describe() {
            return "agent exit=" + exitCode + (stderr == null || stderr.isBlank() ? "" : " stderr=" + stderr);
        }
    }
}

package com.phillippitts.geminibridge.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionResultTest {

    @Test
    void timeoutUsesSentinelExitCode() {
        ExecutionResult result = ExecutionResult.timeout(30_000);

        assertThat(result.success()).isFalse();
        assertThat(result.isTimeout()).isTrue();
        assertThat(result.isInternalError()).isFalse();
        assertThat(result.exitCode()).isEqualTo(-1);
        assertThat(result.error()).isEqualTo("Execution timeout");
    }

    @Test
    void internalErrorIsDistinctFromTimeout() {
        ExecutionResult result = ExecutionResult.internalError("workdir failed", 3);

        assertThat(result.isInternalError()).isTrue();
        assertThat(result.isTimeout()).isFalse();
        assertThat(result.exitCode()).isEqualTo(-2);
    }

    @Test
    void realExitCodeMinusOneFromSuccessIsNotTimeout() {
        ExecutionResult ok = ExecutionResult.success("hi", null, 10);

        assertThat(ok.isTimeout()).isFalse();
        assertThat(ok.stderr()).isEmpty();
        assertThat(ok.error()).isNull();
    }

    @Test
    void negativeElapsedIsClamped() {
        assertThat(ExecutionResult.failure("x", 1, "err", -5).elapsedMs()).isZero();
    }
}

package com.phillippitts.geminibridge.service.cli.conflict;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.phillippitts.geminibridge.service.cli.conflict.ConflictDetectorTest.CONFLICT_STDERR;
import static org.assertj.core.api.Assertions.assertThat;

class ConflictRecoveryStrategyTest {

    private static final String NAME = "sandbox-0.23.0-0";

    private final FakeContainerRuntime runtime = new FakeContainerRuntime();
    private final ConflictRecoveryStrategy strategy =
            new ConflictRecoveryStrategy(runtime, "sandbox-", Duration.ofMillis(10));

    @Test
    void naturalReleaseRemovesStoppedContainerWithoutForce() {
        runtime.states(ContainerState.RUNNING, ContainerState.RUNNING, ContainerState.STOPPED);

        RecoveryOutcome outcome = strategy.recover(CONFLICT_STDERR, 5);

        assertThat(outcome).isEqualTo(RecoveryOutcome.RELEASED);
        assertThat(runtime.calls).contains("rm " + NAME).doesNotContain("stop " + NAME, "rm -f " + NAME);
    }

    @Test
    void containerAlreadyGoneNeedsNoRemoval() {
        runtime.states(ContainerState.NOT_FOUND);

        assertThat(strategy.recover(CONFLICT_STDERR, 5)).isEqualTo(RecoveryOutcome.RELEASED);
        assertThat(runtime.count("rm")).isZero();
    }

    @Test
    void stillRunningAfterTimeoutIsForceReclaimed() {
        runtime.states(ContainerState.RUNNING);

        RecoveryOutcome outcome = strategy.recover(CONFLICT_STDERR, 0);

        assertThat(outcome).isEqualTo(RecoveryOutcome.FORCE_RECLAIMED);
        assertThat(runtime.calls).containsSubsequence("stop " + NAME, "rm -f " + NAME);
    }

    @Test
    void zeroTimeoutChecksOnce() {
        runtime.states(ContainerState.RUNNING);

        assertThat(strategy.waitForNaturalRelease(NAME, 0)).isFalse();
        assertThat(runtime.count("state")).isEqualTo(1);
    }

    @Test
    void waitPollsUntilReleased() {
        runtime.states(ContainerState.RUNNING, ContainerState.UNKNOWN, ContainerState.NOT_FOUND);

        assertThat(strategy.waitForNaturalRelease(NAME, 5)).isTrue();
        assertThat(runtime.count("state")).isEqualTo(3);
    }

    @Test
    void missingContainerNameSkipsCleanup() {
        RecoveryOutcome outcome = strategy.recover("Conflict: already in use", 5);

        assertThat(outcome).isEqualTo(RecoveryOutcome.NO_CONTAINER_NAME);
        assertThat(outcome.shouldRetry()).isTrue();
        assertThat(runtime.calls).isEmpty();
    }

    @Test
    void failedRemovalStillAllowsRetry() {
        runtime.states(ContainerState.STOPPED).removeFails();

        RecoveryOutcome outcome = strategy.recover(CONFLICT_STDERR, 1);

        assertThat(outcome).isEqualTo(RecoveryOutcome.RECLAIM_FAILED);
        assertThat(outcome.shouldRetry()).isTrue();
    }

    @Test
    void nonForcedReclaimNeverTouchesRunningContainer() {
        runtime.states(ContainerState.RUNNING);

        assertThat(strategy.reclaim(NAME, false)).isFalse();
        assertThat(runtime.count("rm")).isZero();
        assertThat(runtime.count("stop")).isZero();
    }

    @Test
    void interruptedWaitStopsRecovery() {
        runtime.states(ContainerState.RUNNING);
        Thread.currentThread().interrupt();
        try {
            assertThat(strategy.recover(CONFLICT_STDERR, 5)).isEqualTo(RecoveryOutcome.INTERRUPTED);
            assertThat(RecoveryOutcome.INTERRUPTED.shouldRetry()).isFalse();
        } finally {
            Thread.interrupted();
        }
        assertThat(runtime.count("rm")).isZero();
    }

    @Test
    void sweepRemovesOnlyStoppedContainers() {
        runtime.listing(
                new ContainerInfo("sandbox-1", ContainerState.STOPPED),
                new ContainerInfo("sandbox-2", ContainerState.RUNNING),
                new ContainerInfo("sandbox-3", ContainerState.STOPPED));

        assertThat(strategy.sweepStoppedContainers()).isEqualTo(2);
        assertThat(runtime.calls).contains("list sandbox-", "rm sandbox-1", "rm sandbox-3")
                .doesNotContain("rm sandbox-2", "rm -f sandbox-2");
    }
}

package com.phillippitts.geminibridge.service.cli;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomizedBackoffPolicyTest {

    private final RandomizedBackoffPolicy policy = new RandomizedBackoffPolicy(500);

    @RepeatedTest(20)
    void delayStaysWithinWideningRanges() {
        assertThat(policy.delayFor(0).toMillis()).isBetween(600L, 1000L);
        assertThat(policy.delayFor(1).toMillis()).isBetween(1000L, 2000L);
        assertThat(policy.delayFor(2).toMillis()).isBetween(1500L, 3500L);
    }

    @Test
    void laterAttemptsUseWidestRange() {
        assertThat(RandomizedBackoffPolicy.minDelayMs(7)).isEqualTo(1000);
        assertThat(RandomizedBackoffPolicy.maxDelayMs(7)).isEqualTo(3000);
        assertThat(RandomizedBackoffPolicy.minDelayMs(-1)).isEqualTo(100);
    }

    @Test
    void zeroSettleDelayAllowed() {
        assertThat(new RandomizedBackoffPolicy(0).delayFor(0).toMillis()).isBetween(100L, 500L);
    }

    @Test
    void rejectsNegativeSettleDelay() {
        assertThatThrownBy(() -> new RandomizedBackoffPolicy(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void noneIsZero() {
        assertThat(BackoffPolicy.none().delayFor(3)).isZero();
    }
}

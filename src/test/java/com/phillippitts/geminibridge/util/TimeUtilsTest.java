package com.phillippitts.geminibridge.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(5_000_000L)).isEqualTo(5L);
        // truncates
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isBetween(950L, 1050L);
    }

    @Test
    void sleepQuietlyCompletesFullSleep() {
        long start = System.nanoTime();

        assertThat(TimeUtils.sleepQuietly(20)).isTrue();

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(15L);
    }

    @Test
    void sleepQuietlyReturnsImmediatelyForNonPositive() {
        assertThat(TimeUtils.sleepQuietly(0)).isTrue();
        assertThat(TimeUtils.sleepQuietly(-10)).isTrue();
    }

    @Test
    void sleepQuietlyRestoresInterruptFlag() throws InterruptedException {
        AtomicBoolean completed = new AtomicBoolean(true);
        AtomicBoolean stillInterrupted = new AtomicBoolean(false);
        Thread sleeper = new Thread(() -> {
            Thread.currentThread().interrupt();
            completed.set(TimeUtils.sleepQuietly(5_000));
            stillInterrupted.set(Thread.currentThread().isInterrupted());
        });

        sleeper.start();
        sleeper.join(2_000);

        assertThat(completed).isFalse();
        assertThat(stillInterrupted).isTrue();
    }
}

package com.payment.processing.core.resilience;

import com.payment.processing.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessorRetryPolicyTest {

    private TestClock clock;
    private ProcessorRetryPolicy retryPolicy;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2026-03-01T12:00:00Z"));
        retryPolicy = new ProcessorRetryPolicy(clock, 5, Duration.ofSeconds(1), Duration.ofSeconds(16));
    }

    @Test
    void firstDelayIsBaseWithJitter() {
        for (int i = 0; i < 50; i++) {
            Duration delay = retryPolicy.getRetryDelay(0);
            assertThat(delay.toMillis()).isBetween(750L, 1250L);
        }
    }

    @Test
    void delayGrowsExponentially() {
        for (int i = 0; i < 50; i++) {
            assertThat(retryPolicy.getRetryDelay(2).toMillis()).isBetween(3000L, 5000L);
        }
    }

    @Test
    void delayIsCapped() {
        for (int i = 0; i < 50; i++) {
            assertThat(retryPolicy.getRetryDelay(10).toMillis()).isLessThanOrEqualTo(20_000L);
        }
    }

    @Test
    void negativeAttemptIsTreatedAsFirst() {
        assertThat(retryPolicy.getRetryDelay(-3).toMillis()).isBetween(750L, 1250L);
    }

    @Test
    void nextRetryTimeIsRelativeToClock() {
        Instant next = retryPolicy.getNextRetryTime(0);

        assertThat(next).isBetween(clock.instant().plusMillis(750), clock.instant().plusMillis(1250));
    }

    @Test
    void declinesAreNeverRetried() {
        assertThat(retryPolicy.isTerminalError("card_declined")).isTrue();
        assertThat(retryPolicy.isTerminalError("Refused")).isTrue();
        assertThat(retryPolicy.shouldRetry(1, "insufficient_funds")).isFalse();
    }

    @Test
    void networkErrorsAreRetryableUntilMaxRetries() {
        assertThat(retryPolicy.isRetryableError("processing_error")).isTrue();
        assertThat(retryPolicy.isRetryableError("Acquirer Error")).isTrue();
        assertThat(retryPolicy.isRetryableError("card_declined")).isFalse();
        assertThat(retryPolicy.isRetryableError(null)).isFalse();

        assertThat(retryPolicy.shouldRetry(4, "processing_error")).isTrue();
        assertThat(retryPolicy.shouldRetry(5, "processing_error")).isFalse();
    }

    @Test
    void unknownErrorsAreNotTerminal() {
        assertThat(retryPolicy.isTerminalError("something_new")).isFalse();
        assertThat(retryPolicy.shouldRetry(1, "something_new")).isTrue();
    }
}

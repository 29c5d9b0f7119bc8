package com.payment.processing.core.resilience;

import com.payment.processing.core.ProviderCallException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderCallExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private final ProviderCallExecutor executor =
            new ProviderCallExecutor(pool, Duration.ofMillis(100), 3, Duration.ofMillis(5));

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void returnsResultOfSuccessfulCall() {
        assertThat(executor.execute("stripe:authorize", () -> "pi_123")).isEqualTo("pi_123");
    }

    @Test
    void retriesNetworkFailuresWithTheSameCall() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("stripe:capture", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ProviderCallException("connection reset");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("stripe:refund", () -> {
            calls.incrementAndGet();
            throw new ProviderCallException("503");
        })).isInstanceOf(ProviderCallException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void slowCallTimesOut() {
        assertThatThrownBy(() -> executor.execute("adyen:authorize", () -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        })).isInstanceOf(ProviderCallException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void otherExceptionsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("stripe:void", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(1);
    }
}

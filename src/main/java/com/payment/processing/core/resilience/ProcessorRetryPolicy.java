package com.payment.processing.core.resilience;

import io.github.resilience4j.core.IntervalFunction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Decides whether a failed authorization may be attempted again and when.
 * Backoff is exponential from {@code base} (x2 per attempt, capped) with
 * +/-25% jitter so retries of many attempts do not line up.
 */
@Component
public class ProcessorRetryPolicy {

    /** Declines and fraud signals: retrying cannot change the outcome. */
    private static final Set<String> TERMINAL_ERRORS = Set.of(
            "card_declined", "insufficient_funds", "expired_card", "incorrect_cvc", "fraudulent",
            "Refused", "Blocked Card", "Expired Card", "Invalid Card Number", "CVC Declined", "Fraud");

    private static final Set<String> RETRYABLE_ERRORS = Set.of(
            "processing_error", "rate_limit", "api_connection_error", "timeout",
            "Acquirer Error", "Issuer Unavailable");

    private static final double JITTER = 0.25;
    private static final double MULTIPLIER = 2.0;

    private final Clock clock;
    private final int maxRetries;
    private final IntervalFunction backoff;

    public ProcessorRetryPolicy(
            Clock clock,
            @Value("${payment.processing.retry.max-retries:5}") int maxRetries,
            @Value("${payment.processing.retry.base-delay:PT1S}") Duration baseDelay,
            @Value("${payment.processing.retry.max-delay:PT16S}") Duration maxDelay) {
        this.clock = clock;
        this.maxRetries = maxRetries;
        this.backoff = IntervalFunction.ofExponentialRandomBackoff(baseDelay, MULTIPLIER, JITTER, maxDelay);
    }

    public boolean shouldRetry(int attemptNumber, String errorCode) {
        if (attemptNumber >= maxRetries) {
            return false;
        }
        return !isTerminalError(errorCode);
    }

    public boolean isRetryableError(String errorCode) {
        return errorCode != null && RETRYABLE_ERRORS.contains(errorCode);
    }

    public boolean isTerminalError(String errorCode) {
        return errorCode != null && TERMINAL_ERRORS.contains(errorCode);
    }

    /**
     * @param attempt zero-based; negative values are treated as 0
     */
    public Duration getRetryDelay(int attempt) {
        int normalized = Math.max(attempt, 0);
        return Duration.ofMillis(backoff.apply(normalized + 1));
    }

    public Instant getNextRetryTime(int attempt) {
        return clock.instant().plus(getRetryDelay(attempt));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}

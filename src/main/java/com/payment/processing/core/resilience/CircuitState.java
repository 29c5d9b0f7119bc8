package com.payment.processing.core.resilience;

import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of one circuit. Replaced wholesale on every transition.
 */
@Value
public class CircuitState {

    public static final CircuitState CLOSED = new CircuitState(0, null, null);

    int failureCount;
    /** Null when closed. */
    Instant openUntil;
    Instant lastFailureAt;

    public boolean isOpenAt(Instant now) {
        return openUntil != null && now.isBefore(openUntil);
    }
}

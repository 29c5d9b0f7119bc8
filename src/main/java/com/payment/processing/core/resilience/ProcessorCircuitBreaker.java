package com.payment.processing.core.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per {@code "{provider}:{org}"} circuit breaker shared by all actors of that
 * org at that provider. Opens after {@code failureThreshold} consecutive
 * failures and rejects calls for {@code openDuration}; after that the next call
 * goes through and a single further failure re-opens it. Any success closes it.
 * <p>
 * State is an immutable {@link CircuitState} per key swapped with CAS, so
 * concurrent actors never block on each other here.
 */
@Slf4j
@Component
public class ProcessorCircuitBreaker {

    private final Map<String, AtomicReference<CircuitState>> circuits = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int failureThreshold;
    private final Duration openDuration;

    public ProcessorCircuitBreaker(
            Clock clock,
            @Value("${payment.processing.circuit-breaker.failure-threshold:3}") int failureThreshold,
            @Value("${payment.processing.circuit-breaker.open-duration:PT30S}") Duration openDuration) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.clock = clock;
        this.failureThreshold = failureThreshold;
        this.openDuration = openDuration;
    }

    public boolean isOpen(String key) {
        AtomicReference<CircuitState> ref = circuits.get(key);
        return ref != null && ref.get().isOpenAt(clock.instant());
    }

    public void recordSuccess(String key) {
        AtomicReference<CircuitState> ref = circuits.get(key);
        if (ref == null) {
            return;
        }
        CircuitState previous = ref.getAndSet(CircuitState.CLOSED);
        if (previous.getFailureCount() >= failureThreshold) {
            log.info("Circuit closed for {} after successful call", key);
        }
    }

    public void recordFailure(String key) {
        AtomicReference<CircuitState> ref = circuits.computeIfAbsent(key, k -> new AtomicReference<>(CircuitState.CLOSED));
        Instant now = clock.instant();
        CircuitState current;
        CircuitState next;
        do {
            current = ref.get();
            int failures = current.getFailureCount() + 1;
            Instant openUntil = failures >= failureThreshold ? now.plus(openDuration) : current.getOpenUntil();
            next = new CircuitState(failures, openUntil, now);
        } while (!ref.compareAndSet(current, next));

        if (next.getFailureCount() >= failureThreshold) {
            log.warn("Circuit open for {} until {} ({} consecutive failures)", key, next.getOpenUntil(), next.getFailureCount());
        } else {
            log.debug("Recorded failure {} of {} for {}", next.getFailureCount(), failureThreshold, key);
        }
    }

    public CircuitState getState(String key) {
        AtomicReference<CircuitState> ref = circuits.get(key);
        return ref == null ? CircuitState.CLOSED : ref.get();
    }

    public void reset(String key) {
        circuits.remove(key);
    }
}

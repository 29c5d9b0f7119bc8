package com.payment.processing.core;

import com.payment.processing.domain.PaymentAttempt;

import java.util.Map;
import java.util.UUID;

/**
 * Mints idempotency keys for one attempt and remembers them in the attempt's
 * durable key map. A key, once minted for an {@code (operation, generation)},
 * never changes, so a repeated provider call after a lost response reuses it.
 * <p>
 * Not thread-safe; only the owning actor uses it.
 */
public final class IdempotencyKeyRegistry {

    private final PaymentAttempt attempt;

    private IdempotencyKeyRegistry(PaymentAttempt attempt) {
        this.attempt = attempt;
    }

    public static IdempotencyKeyRegistry of(PaymentAttempt attempt) {
        return new IdempotencyKeyRegistry(attempt);
    }

    public String getOrCreate(String operation, int generation) {
        Map<String, String> keys = attempt.getIdempotencyKeys();
        String mapKey = operation + "_" + generation;
        String existing = keys.get(mapKey);
        if (existing != null) {
            return existing;
        }
        String key = newKey(attempt.getPaymentIntentId(), operation);
        keys.putIfAbsent(mapKey, key);
        return keys.get(mapKey);
    }

    public static String newKey(UUID paymentIntentId, String operation) {
        return "idem_" + compact(paymentIntentId) + "_" + operation + "_" + compact(UUID.randomUUID());
    }

    private static String compact(UUID id) {
        return id.toString().replace("-", "");
    }
}

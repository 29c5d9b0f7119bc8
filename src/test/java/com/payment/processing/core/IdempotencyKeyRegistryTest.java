package com.payment.processing.core;

import com.payment.processing.domain.PaymentAttempt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyKeyRegistryTest {

    private PaymentAttempt attempt;

    @BeforeEach
    void setUp() {
        attempt = new PaymentAttempt();
        attempt.setPaymentIntentId(UUID.fromString("7a0c1f6e-2b3d-4e5f-8a9b-0c1d2e3f4a5b"));
    }

    @Test
    void sameOperationAndGenerationReusesKey() {
        String first = IdempotencyKeyRegistry.of(attempt).getOrCreate("capture_1000", 0);
        String second = IdempotencyKeyRegistry.of(attempt).getOrCreate("capture_1000", 0);

        assertThat(second).isEqualTo(first);
        assertThat(attempt.getIdempotencyKeys()).containsEntry("capture_1000_0", first);
    }

    @Test
    void newGenerationGetsNewKey() {
        IdempotencyKeyRegistry keys = IdempotencyKeyRegistry.of(attempt);

        String first = keys.getOrCreate("authorize", 0);
        String retry = keys.getOrCreate("authorize", 1);

        assertThat(retry).isNotEqualTo(first);
        assertThat(attempt.getIdempotencyKeys()).containsOnlyKeys("authorize_0", "authorize_1");
    }

    @Test
    void keyNamesPaymentIntentAndOperation() {
        String key = IdempotencyKeyRegistry.of(attempt).getOrCreate("void", 0);

        assertThat(key).matches("idem_7a0c1f6e2b3d4e5f8a9b0c1d2e3f4a5b_void_[0-9a-f]{32}");
    }
}

package com.payment.processing.persistence.service;

import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.AttemptStatus;
import com.payment.processing.domain.AuthorizationRequest;
import com.payment.processing.domain.PaymentAttempt;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.persistence.AttemptDocumentCodec;
import com.payment.processing.persistence.ConcurrentAttemptModificationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAttemptStoreTest {

    private final InMemoryAttemptStore store = new InMemoryAttemptStore(new AttemptDocumentCodec());
    private final AttemptKey key = AttemptKey.of(UUID.randomUUID(), ProcessorName.STRIPE, UUID.randomUUID());

    @Test
    void loadedCopyIsDetachedFromStore() {
        PaymentAttempt attempt = attempt("pi_1");
        attempt.setVersion(1);
        store.save(key, attempt, 0);

        PaymentAttempt loaded = store.load(key).orElseThrow();
        loaded.setStatus(AttemptStatus.VOIDED);

        assertThat(store.load(key).orElseThrow().getStatus()).isEqualTo(AttemptStatus.AUTHORIZED);
    }

    @Test
    void versionGuardRejectsStaleWrites() {
        PaymentAttempt attempt = attempt("pi_1");
        attempt.setVersion(1);
        store.save(key, attempt, 0);

        assertThatThrownBy(() -> store.save(key, attempt, 0))
                .isInstanceOf(ConcurrentAttemptModificationException.class);

        attempt.setVersion(2);
        store.save(key, attempt, 1);
        assertThat(store.load(key).orElseThrow().getVersion()).isEqualTo(2);
    }

    @Test
    void findsByReference() {
        PaymentAttempt attempt = attempt("pi_9");
        attempt.setVersion(1);
        store.save(key, attempt, 0);

        assertThat(store.findByProviderReference(ProcessorName.STRIPE, "pi_9")).contains(key);
        assertThat(store.findByProviderReference(ProcessorName.ADYEN, "pi_9")).isEmpty();
        assertThat(store.findByProviderReference(ProcessorName.STRIPE, null)).isEmpty();
    }

    private PaymentAttempt attempt(String reference) {
        PaymentAttempt attempt = PaymentAttempt.initialize(key, AuthorizationRequest.builder()
                .amount(700)
                .currency("eur")
                .captureAutomatically(false)
                .build(), Instant.parse("2026-03-01T12:00:00Z"));
        attempt.setStatus(AttemptStatus.AUTHORIZED);
        attempt.setAuthorizedAmount(700);
        attempt.setProviderReference(reference);
        return attempt;
    }
}

package com.payment.processing.persistence.service;

import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.PaymentAttempt;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.persistence.ConcurrentAttemptModificationException;

import java.util.Optional;

/**
 * Durable home of payment attempts. Writes are compare-and-set on the attempt version.
 */
public interface AttemptStore {

    Optional<PaymentAttempt> load(AttemptKey key);

    /**
     * Persist {@code attempt} (already carrying its new version) if the stored
     * version is still {@code expectedVersion}; 0 means "must not exist yet".
     *
     * @throws ConcurrentAttemptModificationException if another writer got there first
     */
    void save(AttemptKey key, PaymentAttempt attempt, long expectedVersion);

    /** Webhook routing: which attempt owns this provider reference. */
    Optional<AttemptKey> findByProviderReference(ProcessorName processor, String providerReference);
}

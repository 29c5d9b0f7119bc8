package com.payment.processing.persistence.service;

import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.PaymentAttempt;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.persistence.AttemptDocumentCodec;
import com.payment.processing.persistence.ConcurrentAttemptModificationException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node attempt store for local runs and tests. Keeps serialized copies
 * so callers never share a live {@link PaymentAttempt} with the store.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payment.processing.store.type", havingValue = "memory")
public class InMemoryAttemptStore implements AttemptStore {

    private final Map<AttemptKey, StoredAttempt> attempts = new ConcurrentHashMap<>();
    private final AttemptDocumentCodec codec;

    @Override
    public Optional<PaymentAttempt> load(AttemptKey key) {
        StoredAttempt stored = attempts.get(key);
        return stored == null ? Optional.empty() : Optional.of(codec.fromJson(stored.document));
    }

    @Override
    public void save(AttemptKey key, PaymentAttempt attempt, long expectedVersion) {
        String document = codec.toJson(attempt);
        attempts.compute(key, (k, current) -> {
            long storedVersion = current == null ? 0 : current.version;
            if (storedVersion != expectedVersion) {
                throw new ConcurrentAttemptModificationException(key, expectedVersion);
            }
            return new StoredAttempt(attempt.getVersion(), attempt.getProviderReference(), document);
        });
    }

    @Override
    public Optional<AttemptKey> findByProviderReference(ProcessorName processor, String providerReference) {
        if (providerReference == null) {
            return Optional.empty();
        }
        return attempts.entrySet().stream()
                .filter(e -> e.getKey().getProcessor() == processor && providerReference.equals(e.getValue().providerReference))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static final class StoredAttempt {
        private final long version;
        private final String providerReference;
        private final String document;

        private StoredAttempt(long version, String providerReference, String document) {
            this.version = version;
            this.providerReference = providerReference;
            this.document = document;
        }
    }
}

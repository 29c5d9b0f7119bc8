package com.payment.processing.persistence.service;

import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.PaymentAttempt;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.persistence.AttemptDocumentCodec;
import com.payment.processing.persistence.ConcurrentAttemptModificationException;
import com.payment.processing.persistence.entity.PaymentAttemptEntity;
import com.payment.processing.persistence.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Attempt store on PostgreSQL. Inserts rely on the primary key to reject a
 * second creator; updates are a single conditional UPDATE on the version column.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payment.processing.store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaAttemptStore implements AttemptStore {

    private final PaymentAttemptRepository repository;
    private final AttemptDocumentCodec codec;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<PaymentAttempt> load(AttemptKey key) {
        return repository.findById(key.asString()).map(entity -> codec.fromJson(entity.getDocument()));
    }

    @Override
    @Transactional
    public void save(AttemptKey key, PaymentAttempt attempt, long expectedVersion) {
        String document = codec.toJson(attempt);
        String status = attempt.getStatus() != null ? attempt.getStatus().getValue() : null;
        Instant now = clock.instant();

        if (expectedVersion == 0) {
            PaymentAttemptEntity entity = PaymentAttemptEntity.builder()
                    .attemptKey(key.asString())
                    .orgId(key.getOrgId().toString())
                    .processor(key.getProcessor())
                    .paymentIntentId(key.getPaymentIntentId().toString())
                    .providerReference(attempt.getProviderReference())
                    .status(status)
                    .document(document)
                    .version(attempt.getVersion())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            try {
                repository.saveAndFlush(entity);
            } catch (DataIntegrityViolationException e) {
                log.warn("Attempt {} already exists; rejecting insert from stale writer", key);
                throw new ConcurrentAttemptModificationException(key, expectedVersion, e);
            }
        } else {
            int updated = repository.updateIfVersionMatches(key.asString(), expectedVersion, attempt.getVersion(),
                    status, attempt.getProviderReference(), document, now);
            if (updated == 0) {
                log.warn("Version guard rejected write for attempt {} (expected version {})", key, expectedVersion);
                throw new ConcurrentAttemptModificationException(key, expectedVersion);
            }
        }
        log.debug("Persisted attempt {} version={} status={}", key, attempt.getVersion(), status);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AttemptKey> findByProviderReference(ProcessorName processor, String providerReference) {
        if (providerReference == null || providerReference.isBlank()) {
            return Optional.empty();
        }
        return repository.findFirstByProcessorAndProviderReference(processor, providerReference)
                .map(entity -> AttemptKey.parse(entity.getAttemptKey()));
    }
}

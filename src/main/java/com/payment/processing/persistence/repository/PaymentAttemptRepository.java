package com.payment.processing.persistence.repository;

import com.payment.processing.domain.ProcessorName;
import com.payment.processing.persistence.entity.PaymentAttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for payment attempts.
 */
@Repository
public interface PaymentAttemptRepository extends JpaRepository<PaymentAttemptEntity, String> {

    Optional<PaymentAttemptEntity> findFirstByProcessorAndProviderReference(ProcessorName processor, String providerReference);

    /**
     * @return 1 if the row was still at {@code expectedVersion} and has been updated, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentAttemptEntity a SET a.document = :document, a.version = :version, a.status = :status, "
            + "a.providerReference = :providerReference, a.updatedAt = :updatedAt "
            + "WHERE a.attemptKey = :attemptKey AND a.version = :expectedVersion")
    int updateIfVersionMatches(@Param("attemptKey") String attemptKey,
                               @Param("expectedVersion") long expectedVersion,
                               @Param("version") long version,
                               @Param("status") String status,
                               @Param("providerReference") String providerReference,
                               @Param("document") String document,
                               @Param("updatedAt") Instant updatedAt);
}

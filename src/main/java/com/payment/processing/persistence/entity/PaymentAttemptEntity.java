package com.payment.processing.persistence.entity;

import com.payment.processing.domain.ProcessorName;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One row per payment attempt. The whole attempt lives in {@code document};
 * the other columns exist for lookup and for the version guard.
 */
@Entity
@Table(name = "payment_attempts", indexes = {
    @Index(name = "idx_attempt_provider_reference", columnList = "processor, provider_reference"),
    @Index(name = "idx_attempt_payment_intent", columnList = "payment_intent_id"),
    @Index(name = "idx_attempt_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAttemptEntity implements Persistable<String> {

    @Id
    @Column(name = "attempt_key", nullable = false, length = 120)
    private String attemptKey;

    @Column(name = "org_id", nullable = false, length = 36)
    private String orgId;

    @Enumerated(EnumType.STRING)
    @Column(name = "processor", nullable = false, length = 20)
    private ProcessorName processor;

    @Column(name = "payment_intent_id", nullable = false, length = 36)
    private String paymentIntentId;

    @Column(name = "provider_reference")
    private String providerReference;

    @Column(name = "status", length = 30)
    private String status;

    @Column(name = "document", nullable = false, columnDefinition = "text")
    private String document;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Rows are inserted once and then only changed through the conditional update. */
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public String getId() {
        return attemptKey;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PostPersist
    @PostLoad
    protected void markPersisted() {
        fresh = false;
    }
}

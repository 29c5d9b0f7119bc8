package com.payment.processing.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Durable state of one payment attempt, owned by exactly one processor actor.
 * Stored as a single JSON document; only the owning actor mutates it.
 */
@Data
@NoArgsConstructor
public class PaymentAttempt {

    private UUID orgId;
    private ProcessorName processor;
    private UUID paymentIntentId;

    private AttemptStatus status;

    private long requestedAmount;
    private long authorizedAmount;
    private long capturedAmount;
    private long refundedAmount;
    private String currency;

    private String providerReference;
    private String authorizationCode;
    private String merchantReference;
    private boolean captureAutomatically;
    private String paymentMethodToken;
    private String statementDescriptor;
    private Map<String, String> metadata = new LinkedHashMap<>();

    private int retryCount;
    private Instant nextRetryAt;
    private Instant lastAttemptAt;
    private String lastErrorCode;
    private String lastErrorMessage;
    private NextAction nextAction;

    private Instant createdAt;
    private Instant authorizedAt;
    private Instant capturedAt;
    private Instant canceledAt;

    /** Insert-only: {@code "{operation}_{generation}" -> key}. */
    private Map<String, String> idempotencyKeys = new LinkedHashMap<>();

    /** Append-only. */
    private List<AttemptEvent> events = new ArrayList<>();

    private long version;

    private List<SplitAllocation> splits = new ArrayList<>();
    private String connectedAccountId;
    private Long applicationFee;
    private int refundCount;

    public static PaymentAttempt initialize(AttemptKey key, AuthorizationRequest request, Instant now) {
        PaymentAttempt attempt = new PaymentAttempt();
        attempt.setOrgId(key.getOrgId());
        attempt.setProcessor(key.getProcessor());
        attempt.setPaymentIntentId(key.getPaymentIntentId());
        attempt.setRequestedAmount(request.getAmount());
        attempt.setCurrency(request.getCurrency().trim().toUpperCase(Locale.ROOT));
        attempt.setCaptureAutomatically(request.isCaptureAutomatically());
        attempt.setPaymentMethodToken(request.getPaymentMethodToken());
        attempt.setStatementDescriptor(request.getStatementDescriptor());
        if (request.getMetadata() != null) {
            attempt.getMetadata().putAll(request.getMetadata());
        }
        attempt.setCreatedAt(now);
        return attempt;
    }

    public void appendEvent(Instant timestamp, String eventType, String providerReference, String data) {
        events.add(AttemptEvent.builder()
                .timestamp(timestamp)
                .eventType(eventType)
                .providerReference(providerReference)
                .data(data)
                .build());
    }

    /** Failed with no retry scheduled. */
    public boolean failedPermanently() {
        return status == AttemptStatus.FAILED && nextRetryAt == null;
    }

    public long refundableAmount() {
        return capturedAmount - refundedAmount;
    }

    public void recordError(String code, String message) {
        this.lastErrorCode = code;
        this.lastErrorMessage = message;
    }

    public void clearError() {
        this.lastErrorCode = null;
        this.lastErrorMessage = null;
    }

    /**
     * @throws IllegalStateException if amounts are inconsistent; a committed attempt never is
     */
    public void checkInvariants() {
        if (capturedAmount > authorizedAmount) {
            throw new IllegalStateException("capturedAmount " + capturedAmount + " exceeds authorizedAmount " + authorizedAmount);
        }
        if (refundedAmount > capturedAmount) {
            throw new IllegalStateException("refundedAmount " + refundedAmount + " exceeds capturedAmount " + capturedAmount);
        }
    }
}

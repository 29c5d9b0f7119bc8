package com.payment.processing.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only projection of an attempt for callers.
 */
@Value
@Builder
public class ProcessorPaymentState {

    ProcessorName processor;
    String orgId;
    String paymentIntentId;
    String transactionId;
    String authorizationCode;
    AttemptStatus status;
    String currency;
    long requestedAmount;
    long authorizedAmount;
    long capturedAmount;
    long refundedAmount;
    int retryCount;
    Instant nextRetryAt;
    Instant lastAttemptAt;
    String lastErrorCode;
    String lastError;
    NextAction nextAction;
    long version;
    List<SplitAllocation> splits;
    List<AttemptEvent> events;

    public static ProcessorPaymentState of(PaymentAttempt attempt) {
        return ProcessorPaymentState.builder()
                .processor(attempt.getProcessor())
                .orgId(attempt.getOrgId().toString())
                .paymentIntentId(attempt.getPaymentIntentId().toString())
                .transactionId(attempt.getProviderReference())
                .authorizationCode(attempt.getAuthorizationCode())
                .status(attempt.getStatus())
                .currency(attempt.getCurrency())
                .requestedAmount(attempt.getRequestedAmount())
                .authorizedAmount(attempt.getAuthorizedAmount())
                .capturedAmount(attempt.getCapturedAmount())
                .refundedAmount(attempt.getRefundedAmount())
                .retryCount(attempt.getRetryCount())
                .nextRetryAt(attempt.getNextRetryAt())
                .lastAttemptAt(attempt.getLastAttemptAt())
                .lastErrorCode(attempt.getLastErrorCode())
                .lastError(attempt.getLastErrorMessage())
                .nextAction(attempt.getNextAction())
                .version(attempt.getVersion())
                .splits(List.copyOf(attempt.getSplits()))
                .events(List.copyOf(attempt.getEvents()))
                .build();
    }
}

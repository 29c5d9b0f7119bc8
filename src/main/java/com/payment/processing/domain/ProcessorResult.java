package com.payment.processing.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of any mutating actor operation. Declines, timeouts and an open
 * circuit are all results, not exceptions.
 */
@Value
@Builder(toBuilder = true)
public class ProcessorResult {

    boolean success;
    AttemptStatus status;
    String transactionId;
    String authorizationCode;
    String networkTransactionId;
    Long amount;
    String errorCode;
    String errorMessage;
    NextAction nextAction;
    /** Set when a transient failure scheduled another authorization attempt. */
    Instant nextRetryAt;

    public static ProcessorResult failure(String errorCode, String errorMessage) {
        return ProcessorResult.builder()
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    public static ProcessorResult failure(AttemptStatus status, String errorCode, String errorMessage) {
        return ProcessorResult.builder()
                .success(false)
                .status(status)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }
}

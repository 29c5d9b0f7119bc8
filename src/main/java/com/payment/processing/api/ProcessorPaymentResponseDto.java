package com.payment.processing.api;

import com.payment.processing.domain.AttemptStatus;
import com.payment.processing.domain.NextAction;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.ProcessorResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * REST response for every mutating payment operation. Declines come back with
 * {@code success=false} and the network's error code, not as an HTTP error.
 */
@Value
@Builder
public class ProcessorPaymentResponseDto {

    UUID paymentIntentId;
    ProcessorName processor;
    boolean success;
    AttemptStatus status;
    String transactionId;
    String authorizationCode;
    String networkTransactionId;
    Long amount;
    String errorCode;
    String errorMessage;
    NextAction nextAction;
    Instant nextRetryAt;

    public static ProcessorPaymentResponseDto from(UUID paymentIntentId, ProcessorName processor, ProcessorResult result) {
        if (result == null) {
            throw new IllegalArgumentException("ProcessorResult cannot be null");
        }
        return ProcessorPaymentResponseDto.builder()
                .paymentIntentId(paymentIntentId)
                .processor(processor)
                .success(result.isSuccess())
                .status(result.getStatus())
                .transactionId(result.getTransactionId())
                .authorizationCode(result.getAuthorizationCode())
                .networkTransactionId(result.getNetworkTransactionId())
                .amount(result.getAmount())
                .errorCode(result.getErrorCode())
                .errorMessage(result.getErrorMessage())
                .nextAction(result.getNextAction())
                .nextRetryAt(result.getNextRetryAt())
                .build();
    }
}

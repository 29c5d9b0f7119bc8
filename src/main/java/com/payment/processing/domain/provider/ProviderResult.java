package com.payment.processing.domain.provider;

import com.payment.processing.domain.NextAction;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized outcome of one provider round-trip.
 * {@code success=false} means the network rejected the request (decline or API
 * error); {@code errorCode} then carries the network's own code.
 */
@Value
@Builder
public class ProviderResult {

    boolean success;
    String reference;
    ProviderPaymentStatus status;
    long amount;
    String authorizationCode;
    String networkTransactionId;
    NextAction nextAction;
    String errorCode;
    String errorMessage;

    public static ProviderResult rejected(String errorCode, String errorMessage) {
        return ProviderResult.builder()
                .success(false)
                .status(ProviderPaymentStatus.DECLINED)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }
}

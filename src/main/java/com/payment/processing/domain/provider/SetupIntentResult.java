package com.payment.processing.domain.provider;

import lombok.Builder;
import lombok.Value;

/**
 * Result of saving a payment method for later use (vault / setup intent).
 */
@Value
@Builder
public class SetupIntentResult {

    boolean success;
    String setupIntentId;
    String clientSecret;
    String status;
    String errorCode;
    String errorMessage;

    public static SetupIntentResult failure(String errorCode, String errorMessage) {
        return SetupIntentResult.builder().success(false).errorCode(errorCode).errorMessage(errorMessage).build();
    }
}

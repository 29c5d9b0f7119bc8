package com.payment.processing.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Message to the payment intent aggregate after an attempt reaches authorized
 * or captured. Serialized as JSON, keyed by payment intent id.
 */
@Value
@Builder
@Jacksonized
public class PaymentIntentUpdate {

    public static final String AUTHORIZED = "AUTHORIZED";
    public static final String CAPTURED = "CAPTURED";

    String eventId;
    String eventType;
    String orgId;
    String paymentIntentId;
    String processor;
    String providerReference;
    String authorizationCode;
    Long authorizedAmount;
    Long capturedAmount;
    String currency;
    Instant timestamp;
}

package com.payment.processing.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Authorization as the caller expresses it, independent of the card network.
 */
@Value
@Builder
public class AuthorizationRequest {

    /** Minor units, must be positive. */
    long amount;

    /** ISO 4217, any case; stored upper-case. */
    String currency;

    /** Network payment method token; never logged in clear. */
    String paymentMethodToken;

    boolean captureAutomatically;

    String statementDescriptor;

    Map<String, String> metadata;
}

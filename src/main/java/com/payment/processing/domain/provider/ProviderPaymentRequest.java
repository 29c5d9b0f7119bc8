package com.payment.processing.domain.provider;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Payment creation request handed to a {@link com.payment.processing.core.ProviderClient}.
 * Each client maps it to its network's native format.
 */
@Value
@Builder
public class ProviderPaymentRequest {

    long amount;
    String currency;
    String paymentMethodToken;
    boolean captureAutomatically;
    /** Merchant reference; Adyen requires one, Stripe ignores it. */
    String reference;
    String statementDescriptor;
    /** Stripe Connect destination account, if charging on behalf of one. */
    String connectedAccountId;
    Long applicationFee;
    Map<String, String> metadata;
}

package com.payment.processing.adapters.stripe;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StripeRefund {

    String id;
    String paymentIntent;
    long amount;
    /** {@code pending, succeeded, failed, canceled}. */
    String status;
    String reason;
    StripeError error;
}

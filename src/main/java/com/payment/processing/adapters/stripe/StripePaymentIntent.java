package com.payment.processing.adapters.stripe;

import lombok.Builder;
import lombok.Value;

/**
 * Payment intent as Stripe describes it. Status is one of
 * {@code requires_payment_method, requires_action, processing, requires_capture, succeeded, canceled}.
 */
@Value
@Builder(toBuilder = true)
public class StripePaymentIntent {

    public static final String REQUIRES_PAYMENT_METHOD = "requires_payment_method";
    public static final String REQUIRES_ACTION = "requires_action";
    public static final String PROCESSING = "processing";
    public static final String REQUIRES_CAPTURE = "requires_capture";
    public static final String SUCCEEDED = "succeeded";
    public static final String CANCELED = "canceled";

    String id;
    String status;
    long amount;
    long amountReceived;
    long amountRefunded;
    String currency;
    String captureMethod;
    String latestCharge;
    String clientSecret;
    String transferDestination;
    Long applicationFeeAmount;
    /** {@code redirect_to_url} or {@code use_stripe_sdk} when status is requires_action. */
    String nextActionType;
    String nextActionUrl;
    StripeError lastPaymentError;
}

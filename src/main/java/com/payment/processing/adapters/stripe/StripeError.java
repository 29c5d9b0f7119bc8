package com.payment.processing.adapters.stripe;

import lombok.Builder;
import lombok.Value;

/**
 * Stripe error object: {@code type} is e.g. {@code card_error} or {@code api_error};
 * {@code declineCode} is set for card declines.
 */
@Value
@Builder
public class StripeError {

    String type;
    String code;
    String declineCode;
    String message;
}

package com.payment.processing.adapters.adyen;

import lombok.Builder;
import lombok.Value;

/**
 * Adyen /payments response. {@code resultCode} is one of {@code Authorised,
 * RedirectShopper, IdentifyShopper, ChallengeShopper, Pending, Received,
 * Refused, Cancelled, Error}.
 */
@Value
@Builder
public class AdyenPaymentResponse {

    String pspReference;
    String merchantReference;
    String resultCode;
    long amountValue;
    String amountCurrency;
    String authCode;
    String refusalReason;
    String refusalReasonCode;
    String actionType;
    String actionUrl;
    String paymentData;
}

package com.payment.processing.adapters.adyen;

import lombok.Builder;
import lombok.Value;

/**
 * Response to capture, refund and cancel requests. Adyen only acknowledges the
 * request here ({@code [capture-received]} etc.); the outcome arrives by webhook.
 */
@Value
@Builder
public class AdyenModificationResponse {

    public static final String CAPTURE_RECEIVED = "[capture-received]";
    public static final String REFUND_RECEIVED = "[refund-received]";
    public static final String CANCEL_RECEIVED = "[cancel-received]";

    String pspReference;
    String paymentPspReference;
    String response;
    long amountValue;
    String errorCode;
    String message;
}

package com.payment.processing.domain;

/**
 * Network-independent meaning of a webhook event type.
 */
public enum WebhookEventKind {
    AUTHORIZATION_SUCCEEDED,
    AUTHORIZATION_FAILED,
    CAPTURED,
    CANCELED,
    REFUNDED,
    CHARGEBACK,
    UNKNOWN
}

package com.payment.processing.domain.provider;

/**
 * Normalized payment status, translated from each network's own vocabulary.
 */
public enum ProviderPaymentStatus {
    REQUIRES_ACTION,
    PENDING,
    AUTHORIZED,
    CAPTURED,
    CANCELED,
    REFUNDED,
    DECLINED
}

package com.payment.processing.core;

/**
 * A provider call did not complete: connection failure, 5xx, or timeout.
 * The outcome at the network is unknown, so the same idempotency key must be
 * used if the call is repeated.
 */
public class ProviderCallException extends RuntimeException {

    public ProviderCallException(String message) {
        super(message);
    }

    public ProviderCallException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.payment.processing.api;

/**
 * Thrown when a request reuses an Idempotency-Key whose earlier request already succeeded.
 */
public class DuplicateRequestException extends RuntimeException {

    private final String idempotencyKey;

    public DuplicateRequestException(String idempotencyKey) {
        super("Request with Idempotency-Key " + idempotencyKey + " was already processed successfully");
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}

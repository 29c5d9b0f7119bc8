package com.payment.processing.core.actor;

import com.payment.processing.domain.AttemptKey;

/**
 * The operation needs an existing attempt (capture, refund, void, state, webhook)
 * but this payment was never authorized at this processor.
 */
public class AttemptNotFoundException extends RuntimeException {

    private final AttemptKey key;

    public AttemptNotFoundException(AttemptKey key) {
        super("No payment attempt " + key);
        this.key = key;
    }

    public AttemptKey getKey() {
        return key;
    }
}

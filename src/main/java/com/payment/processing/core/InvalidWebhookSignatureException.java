package com.payment.processing.core;

import com.payment.processing.domain.ProcessorName;

/**
 * Webhook body did not verify against the configured secret. Nothing in it was applied.
 */
public class InvalidWebhookSignatureException extends RuntimeException {

    private final ProcessorName processor;

    public InvalidWebhookSignatureException(ProcessorName processor, String message) {
        super(message);
        this.processor = processor;
    }

    public ProcessorName getProcessor() {
        return processor;
    }
}

package com.payment.processing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one payment attempt at one processor.
 * <pre>
 * (uninitialized) -> requires_action | pending | authorized | captured | failed
 * requires_action | pending -> authorized | captured | failed | voided
 * authorized -> captured | voided
 * captured -> refunded | disputed
 * failed (retry scheduled) -> same as uninitialized
 * </pre>
 */
public enum AttemptStatus {
    REQUIRES_ACTION("requires_action"),
    PENDING("pending"),
    AUTHORIZED("authorized"),
    CAPTURED("captured"),
    VOIDED("voided"),
    REFUNDED("refunded"),
    FAILED("failed"),
    DISPUTED("disputed");

    private final String value;

    AttemptStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AttemptStatus fromValue(String value) {
        for (AttemptStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown attempt status: " + value);
    }

    /** Waiting on the customer or the network; a webhook completes it. */
    public boolean isAwaitingCompletion() {
        return this == REQUIRES_ACTION || this == PENDING;
    }
}

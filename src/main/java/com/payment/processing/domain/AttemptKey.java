package com.payment.processing.domain;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a processor actor: {@code "{orgId}:{processor}:{paymentIntentId}"}.
 * The same payment intent at two processors is two independent attempts.
 */
@Value
public class AttemptKey {

    UUID orgId;
    ProcessorName processor;
    UUID paymentIntentId;

    public static AttemptKey of(UUID orgId, ProcessorName processor, UUID paymentIntentId) {
        return new AttemptKey(
                Objects.requireNonNull(orgId, "orgId"),
                Objects.requireNonNull(processor, "processor"),
                Objects.requireNonNull(paymentIntentId, "paymentIntentId"));
    }

    public static AttemptKey parse(String value) {
        String[] parts = value == null ? new String[0] : value.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Attempt key must be {org}:{processor}:{paymentIntent}, got " + value);
        }
        return of(UUID.fromString(parts[0]), ProcessorName.fromValue(parts[1]), UUID.fromString(parts[2]));
    }

    /** Circuit breakers are shared by every attempt of one org at one processor. */
    public String circuitKey() {
        return processor.getValue() + ":" + orgId;
    }

    public String asString() {
        return orgId + ":" + processor.getValue() + ":" + paymentIntentId;
    }

    @Override
    public String toString() {
        return asString();
    }
}

package com.payment.processing.core.idempotency;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Stored state of one caller-supplied or generated request key.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class IdempotencyKeyStatus {

    String key;
    String operation;
    String relatedEntityId;
    Instant generatedAt;
    Instant expiresAt;
    boolean used;
    Instant usedAt;
    Boolean successful;
    String resultHash;
}

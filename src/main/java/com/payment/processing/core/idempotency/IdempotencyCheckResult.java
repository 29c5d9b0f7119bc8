package com.payment.processing.core.idempotency;

import lombok.Value;

@Value
public class IdempotencyCheckResult {

    public static final IdempotencyCheckResult NOT_FOUND = new IdempotencyCheckResult(false, false, null, null);

    boolean exists;
    boolean alreadyUsed;
    Boolean previousSuccess;
    String previousResultHash;

    static IdempotencyCheckResult of(IdempotencyKeyStatus status) {
        return new IdempotencyCheckResult(true, status.isUsed(), status.getSuccessful(), status.getResultHash());
    }
}

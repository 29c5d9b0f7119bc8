package com.payment.processing.persistence;

import com.payment.processing.domain.AttemptKey;

/**
 * A commit was rejected because the stored attempt is no longer at the version
 * the writer loaded. Another instance wrote it first.
 */
public class ConcurrentAttemptModificationException extends RuntimeException {

    public ConcurrentAttemptModificationException(AttemptKey key, long expectedVersion) {
        super("Attempt " + key + " was modified concurrently (expected version " + expectedVersion + ")");
    }

    public ConcurrentAttemptModificationException(AttemptKey key, long expectedVersion, Throwable cause) {
        super("Attempt " + key + " was modified concurrently (expected version " + expectedVersion + ")", cause);
    }
}

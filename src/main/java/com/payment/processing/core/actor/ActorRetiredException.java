package com.payment.processing.core.actor;

/**
 * Work was submitted to an actor after the idle sweep retired it. The registry
 * catches this and re-activates the attempt.
 */
public class ActorRetiredException extends RuntimeException {

    public ActorRetiredException(String actorKey) {
        super("Processor actor " + actorKey + " has been retired");
    }
}

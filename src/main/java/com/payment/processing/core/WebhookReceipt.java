package com.payment.processing.core;

import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * What happened to one webhook delivery. {@code completion} finishes once every
 * dispatched notification has been applied by its actor.
 */
@Value
public class WebhookReceipt {

    int received;
    int dispatched;
    CompletableFuture<Void> completion;
}

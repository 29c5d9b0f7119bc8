package com.payment.processing.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One provider notification after the envelope has been parsed, ready to be
 * routed to the actor owning {@code providerReference}.
 */
@Value
@Builder
public class WebhookNotification {

    String eventType;
    String providerReference;
    String rawPayload;
}

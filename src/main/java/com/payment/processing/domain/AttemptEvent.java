package com.payment.processing.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One entry of an attempt's append-only audit log. Sync outcomes and webhook
 * deliveries both land here, in the order the actor processed them.
 */
@Value
@Builder
@Jacksonized
public class AttemptEvent {

    Instant timestamp;
    String eventType;
    String providerReference;
    String data;
}

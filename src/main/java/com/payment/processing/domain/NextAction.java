package com.payment.processing.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * What the customer must do before an authorization can complete (3-D Secure
 * challenge, redirect). Opaque to the actor; passed through to the caller.
 */
@Value
@Builder
@Jacksonized
public class NextAction {

    String type;
    String redirectUrl;
    String clientSecret;
    Map<String, String> data;
}

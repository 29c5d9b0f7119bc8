package com.payment.processing.domain.provider;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConnectionTokenResult {

    boolean success;
    String secret;
    String errorCode;
    String errorMessage;

    public static ConnectionTokenResult failure(String errorCode, String errorMessage) {
        return ConnectionTokenResult.builder().success(false).errorCode(errorCode).errorMessage(errorMessage).build();
    }
}

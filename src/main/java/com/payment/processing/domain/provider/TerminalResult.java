package com.payment.processing.domain.provider;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TerminalResult {

    boolean success;
    String terminalId;
    String deviceType;
    String serialNumber;
    String status;
    String errorCode;
    String errorMessage;

    public static TerminalResult failure(String errorCode, String errorMessage) {
        return TerminalResult.builder().success(false).errorCode(errorCode).errorMessage(errorMessage).build();
    }
}

package com.payment.processing.api;

import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.provider.TerminalResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TerminalResponseDto {

    boolean success;
    String terminalId;
    ProcessorName processor;
    String processorTerminalId;
    String deviceType;
    String serialNumber;
    String status;
    String errorCode;
    String errorMessage;

    public static TerminalResponseDto from(String terminalId, ProcessorName processor, TerminalResult result) {
        return TerminalResponseDto.builder()
                .success(result.isSuccess())
                .terminalId(terminalId)
                .processor(processor)
                .processorTerminalId(result.getTerminalId())
                .deviceType(result.getDeviceType())
                .serialNumber(result.getSerialNumber())
                .status(result.getStatus())
                .errorCode(result.getErrorCode())
                .errorMessage(result.getErrorMessage())
                .build();
    }
}

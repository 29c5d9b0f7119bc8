package com.payment.processing.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class CaptureRequestDto {

    @NotBlank
    private String transactionId;

    /** Omit to capture the full authorized amount. */
    @Positive
    private Long amount;
}

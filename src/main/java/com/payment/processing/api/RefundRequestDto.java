package com.payment.processing.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class RefundRequestDto {

    @NotBlank
    private String transactionId;

    @NotNull
    @Positive
    private Long amount;

    private String reason;
}

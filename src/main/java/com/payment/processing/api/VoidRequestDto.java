package com.payment.processing.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class VoidRequestDto {

    @NotBlank
    private String transactionId;

    private String reason;
}

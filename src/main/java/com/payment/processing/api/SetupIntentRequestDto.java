package com.payment.processing.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class SetupIntentRequestDto {

    @NotNull
    private UUID paymentIntentId;

    @NotBlank
    private String customerId;
}

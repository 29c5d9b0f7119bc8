package com.payment.processing.api;

import com.payment.processing.domain.ProcessorName;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Stripe pairs a reader with its registration code and location; Adyen assigns
 * the terminal (path id) to a store.
 */
@Data
public class PairTerminalRequestDto {

    @NotNull
    private ProcessorName processor;

    private String registrationCode;
    private String label;
    private String locationId;
    private String storeId;
}

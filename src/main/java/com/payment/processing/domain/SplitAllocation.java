package com.payment.processing.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Share of a split payment routed to one account (marketplace, commission, VAT...).
 */
@Value
@Builder
@Jacksonized
public class SplitAllocation {

    @NotBlank
    String account;

    /** Minor units. */
    @Positive
    long amount;

    /** Network split type, e.g. "MarketPlace", "Commission", "VAT". */
    @NotBlank
    String type;

    String reference;
}

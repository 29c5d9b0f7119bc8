package com.payment.processing.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Destination charge for a connected account (acct_...), optionally keeping an application fee.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class OnBehalfOfRequestDto extends AuthorizationDetailsDto {

    @NotBlank
    private String connectedAccountId;

    @PositiveOrZero
    private Long applicationFee;
}

package com.payment.processing.api;

import com.payment.processing.domain.SplitAllocation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class SplitAuthorizationRequestDto extends AuthorizationDetailsDto {

    /** Amounts must add up to {@code amount}. */
    @NotEmpty
    private List<@Valid SplitAllocation> splits;
}

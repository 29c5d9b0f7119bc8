package com.payment.processing.api;

import com.payment.processing.domain.AuthorizationRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;

/**
 * Fields every authorization variant accepts.
 */
@Data
public class AuthorizationDetailsDto {

    /** Minor units (e.g. cents). */
    @NotNull
    @Positive
    private Long amount;

    /** ISO 4217, any case. */
    @NotBlank
    @Size(min = 3, max = 3)
    private String currency;

    /** Network token from the client SDK (pm_..., scheme_...). */
    private String paymentMethodToken;

    /** Defaults to true: authorize and capture in one step. */
    private Boolean captureAutomatically;

    @Size(max = 22)
    private String statementDescriptor;

    private Map<String, String> metadata;

    public AuthorizationRequest toAuthorizationRequest() {
        return AuthorizationRequest.builder()
                .amount(amount)
                .currency(currency)
                .paymentMethodToken(paymentMethodToken)
                .captureAutomatically(captureAutomatically == null || captureAutomatically)
                .statementDescriptor(statementDescriptor)
                .metadata(metadata)
                .build();
    }
}

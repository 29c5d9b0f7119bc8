package com.payment.processing.api;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.UUID;

/**
 * REST body for a plain authorization. Send the payment intent id on retries;
 * when omitted a new payment intent id is assigned.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class AuthorizePaymentRequestDto extends AuthorizationDetailsDto {

    private UUID paymentIntentId;
}

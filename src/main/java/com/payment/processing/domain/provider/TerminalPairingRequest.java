package com.payment.processing.domain.provider;

import lombok.Builder;
import lombok.Value;

/**
 * Card-present terminal registration. Stripe pairs with a registration code and
 * location; Adyen assigns a terminal id to a store.
 */
@Value
@Builder
public class TerminalPairingRequest {

    String registrationCode;
    String label;
    String locationId;
    String terminalId;
    String storeId;
}

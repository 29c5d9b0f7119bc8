package com.payment.processing.core;

import com.payment.processing.domain.ErrorCodes;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.SplitAllocation;
import com.payment.processing.domain.WebhookEventKind;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.domain.provider.ConnectionTokenResult;
import com.payment.processing.domain.provider.ProviderPaymentRequest;
import com.payment.processing.domain.provider.ProviderResult;
import com.payment.processing.domain.provider.SetupIntentResult;
import com.payment.processing.domain.provider.TerminalPairingRequest;
import com.payment.processing.domain.provider.TerminalResult;

import java.time.Duration;
import java.util.List;

/**
 * What every card network client needs to implement.
 * Talks to one network in its own vocabulary and hands back normalized results.
 * <p>
 * Network failures (connection reset, 5xx, read timeout) are thrown as
 * {@link ProviderCallException}; declines and API errors are returned as
 * results with {@code success=false}. Every payment call carries the
 * idempotency key the network must use to deduplicate it.
 */
public interface ProviderClient {

    ProcessorName getProcessor();

    ProviderResult createPayment(ProviderPaymentRequest request, String idempotencyKey, Duration timeout);

    ProviderResult capture(String reference, long amount, String currency, String idempotencyKey, Duration timeout);

    ProviderResult refund(String reference, long amount, String currency, String reason, String idempotencyKey, Duration timeout);

    ProviderResult cancel(String reference, String reason, String idempotencyKey, Duration timeout);

    /**
     * Authorize with the amount split across several accounts. Sum of splits must equal the amount.
     */
    default ProviderResult createSplitPayment(ProviderPaymentRequest request, List<SplitAllocation> splits,
                                              String idempotencyKey, Duration timeout) {
        return ProviderResult.rejected(ErrorCodes.UNSUPPORTED_OPERATION,
                getProcessor() + " does not support split payments");
    }

    /** Save a payment method for later use without charging it. */
    default SetupIntentResult createSetupIntent(String customerId, String idempotencyKey, Duration timeout) {
        return SetupIntentResult.failure(ErrorCodes.UNSUPPORTED_OPERATION,
                getProcessor() + " does not support setup intents");
    }

    default TerminalResult registerTerminal(TerminalPairingRequest request, Duration timeout) {
        return TerminalResult.failure(ErrorCodes.UNSUPPORTED_OPERATION,
                getProcessor() + " does not support terminal pairing");
    }

    default ConnectionTokenResult createConnectionToken(String locationId, Duration timeout) {
        return ConnectionTokenResult.failure(ErrorCodes.UNSUPPORTED_OPERATION,
                getProcessor() + " does not issue terminal connection tokens");
    }

    /**
     * @return true only if {@code signature} is a valid signature of {@code payload} under {@code secret}
     */
    boolean verifyWebhookSignature(String payload, String signature, String secret);

    /**
     * Split a (verified) webhook body into the notifications it carries.
     *
     * @throws IllegalArgumentException if the body is not a notification this network sends
     */
    List<WebhookNotification> parseWebhook(String payload);

    WebhookEventKind classifyWebhookEvent(String eventType, String rawPayload);
}

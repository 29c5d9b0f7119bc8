package com.payment.processing.core.actor;

import com.payment.processing.core.ProviderClient;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.AuthorizationRequest;
import com.payment.processing.domain.ErrorCodes;
import com.payment.processing.domain.PaymentAttempt;
import com.payment.processing.domain.ProcessorResult;
import com.payment.processing.domain.provider.SetupIntentResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Stripe-style card network: adds Connect charges on behalf of a connected
 * account and setup intents for saving a card.
 */
@Slf4j
public class StripeProcessorActor extends ProcessorActor {

    public StripeProcessorActor(AttemptKey key, ProviderClient client, ProcessorActorContext context) {
        super(key, client, context);
    }

    /**
     * Authorize as a destination charge; funds settle to {@code connectedAccountId}
     * minus {@code applicationFee}.
     */
    public ProcessorResult authorizeOnBehalfOf(AuthorizationRequest request, String connectedAccountId, Long applicationFee) {
        if (connectedAccountId == null || connectedAccountId.isBlank()) {
            throw new IllegalArgumentException("connectedAccountId is required");
        }
        if (applicationFee != null && (applicationFee < 0 || applicationFee > request.getAmount())) {
            return ProcessorResult.failure(ErrorCodes.INVALID_AMOUNT, "Application fee must be between 0 and the payment amount");
        }
        return askForResult(AUTHORIZE, () -> runAuthorization(AUTHORIZE, request, attempt -> {
            attempt.setConnectedAccountId(connectedAccountId);
            attempt.setApplicationFee(applicationFee);
        }, client::createPayment));
    }

    /**
     * Create a setup intent to vault a card for {@code customerId}. Does not
     * require an authorized attempt; when one exists the key is recorded on it.
     */
    public SetupIntentResult createSetupIntent(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customerId is required");
        }
        return ask(() -> {
            if (isCircuitOpen()) {
                return SetupIntentResult.failure(ErrorCodes.CIRCUIT_OPEN,
                        "Payment processor temporarily unavailable. Please try again later.");
            }
            PaymentAttempt attempt = current();
            String operation = "setup_" + customerId;
            String idempotencyKey = attempt != null
                    ? keys(attempt).getOrCreate(operation, 0)
                    : "idem_" + key.getPaymentIntentId().toString().replace("-", "") + "_" + operation;

            SetupIntentResult result;
            try {
                result = callProvider("setup_intent", () -> client.createSetupIntent(customerId, idempotencyKey, timeout()));
            } catch (RuntimeException e) {
                log.warn("Setup intent creation failed for attempt {}: {}", key, e.getMessage());
                recordCircuitFailure();
                return SetupIntentResult.failure(ErrorCodes.PROCESSING_ERROR, e.getMessage());
            }
            recordCircuitSuccess();

            if (attempt != null) {
                attempt.appendEvent(now(), result.isSuccess() ? "setup_intent_created" : "setup_intent_failed",
                        result.getSetupIntentId(), result.isSuccess() ? null : result.getErrorCode());
                commit(attempt);
            }
            return result;
        });
    }
}

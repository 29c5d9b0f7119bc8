package com.payment.processing.adapters.stripe;

import com.payment.processing.adapters.WebhookSignatures;
import com.payment.processing.core.ProviderClient;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.WebhookEventKind;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.domain.provider.ConnectionTokenResult;
import com.payment.processing.domain.provider.ProviderPaymentRequest;
import com.payment.processing.domain.provider.ProviderResult;
import com.payment.processing.domain.provider.SetupIntentResult;
import com.payment.processing.domain.provider.TerminalPairingRequest;
import com.payment.processing.domain.provider.TerminalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Sandbox Stripe. Keeps payment intents in memory and answers in Stripe's own
 * vocabulary, which {@link StripeResponseMapper} then normalizes. Requests
 * repeated with the same idempotency key get the first response back, as on
 * the real API.
 * <p>
 * Test payment methods: {@code pm_card_threeDSecureRequired} (3-D Secure),
 * {@code pm_card_chargeDeclined}, {@code pm_card_insufficientFunds},
 * {@code pm_card_chargeDeclinedProcessingError} (retryable),
 * {@code pm_card_processing} (async confirmation). Amounts of 99,999,900 minor
 * units or more are declined.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.processing.providers.stripe.sandbox", havingValue = "true", matchIfMissing = true)
public class MockStripeClient implements ProviderClient {

    static final long DECLINE_AMOUNT_THRESHOLD = 99_999_900L;
    private static final long SIGNATURE_TOLERANCE_SECONDS = 300;

    private final StripeResponseMapper mapper = new StripeResponseMapper();
    private final Map<String, StripePaymentIntent> intents = new ConcurrentHashMap<>();
    private final Map<String, ProviderResult> paymentResponses = new ConcurrentHashMap<>();
    private final Map<String, SetupIntentResult> setupIntentResponses = new ConcurrentHashMap<>();
    private final Clock clock;

    public MockStripeClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ProcessorName getProcessor() {
        return ProcessorName.STRIPE;
    }

    @Override
    public ProviderResult createPayment(ProviderPaymentRequest request, String idempotencyKey, Duration timeout) {
        return replay(paymentResponses, idempotencyKey, () -> {
            StripePaymentIntent created = newIntent(request);
            intents.put(created.getId(), created);
            log.debug("MockStripeClient payment intent {} status={} amount={}", created.getId(), created.getStatus(), created.getAmount());
            return mapper.toResult(created);
        });
    }

    @Override
    public ProviderResult capture(String reference, long amount, String currency, String idempotencyKey, Duration timeout) {
        return replay(paymentResponses, idempotencyKey, () -> {
            StripePaymentIntent intent = intents.get(reference);
            if (intent == null) {
                return mapper.toResult(missing(reference));
            }
            if (!StripePaymentIntent.REQUIRES_CAPTURE.equals(intent.getStatus())) {
                return mapper.toResult(unexpectedState(intent, "captured"));
            }
            if (amount > intent.getAmount()) {
                return mapper.toResult(StripeError.builder().type("invalid_request_error").code("amount_too_large")
                        .message("Amount to capture exceeds the capturable amount").build());
            }
            StripePaymentIntent captured = intent.toBuilder()
                    .status(StripePaymentIntent.SUCCEEDED)
                    .amountReceived(amount)
                    .build();
            intents.put(reference, captured);
            return mapper.toResult(captured);
        });
    }

    @Override
    public ProviderResult refund(String reference, long amount, String currency, String reason,
                                 String idempotencyKey, Duration timeout) {
        return replay(paymentResponses, idempotencyKey, () -> {
            StripePaymentIntent intent = intents.get(reference);
            if (intent == null) {
                return mapper.toResult(missing(reference));
            }
            if (!StripePaymentIntent.SUCCEEDED.equals(intent.getStatus())) {
                return mapper.toResult(unexpectedState(intent, "refunded"));
            }
            if (intent.getAmountRefunded() + amount > intent.getAmountReceived()) {
                return mapper.toResult(StripeError.builder().type("invalid_request_error").code("charge_already_refunded")
                        .message("Refund amount exceeds the remaining charge amount").build());
            }
            intents.put(reference, intent.toBuilder().amountRefunded(intent.getAmountRefunded() + amount).build());
            return mapper.toResult(StripeRefund.builder()
                    .id("re_" + randomId())
                    .paymentIntent(reference)
                    .amount(amount)
                    .status("succeeded")
                    .reason(reason)
                    .build());
        });
    }

    @Override
    public ProviderResult cancel(String reference, String reason, String idempotencyKey, Duration timeout) {
        return replay(paymentResponses, idempotencyKey, () -> {
            StripePaymentIntent intent = intents.get(reference);
            if (intent == null) {
                return mapper.toResult(missing(reference));
            }
            if (StripePaymentIntent.SUCCEEDED.equals(intent.getStatus()) || StripePaymentIntent.CANCELED.equals(intent.getStatus())) {
                return mapper.toResult(unexpectedState(intent, "canceled"));
            }
            StripePaymentIntent canceled = intent.toBuilder().status(StripePaymentIntent.CANCELED).build();
            intents.put(reference, canceled);
            return mapper.toCancellationResult(canceled);
        });
    }

    /**
     * Sandbox only: the customer finished the 3-D Secure challenge, or the
     * asynchronous method settled. Moves the intent on as Stripe would before
     * sending {@code payment_intent.succeeded} / {@code amount_capturable_updated}.
     *
     * @return the intent's new Stripe status
     */
    public String completePendingIntent(String paymentIntentId) {
        StripePaymentIntent intent = intents.get(paymentIntentId);
        if (intent == null) {
            throw new IllegalArgumentException("No such payment_intent: '" + paymentIntentId + "'");
        }
        if (!StripePaymentIntent.REQUIRES_ACTION.equals(intent.getStatus())
                && !StripePaymentIntent.PROCESSING.equals(intent.getStatus())) {
            return intent.getStatus();
        }
        StripePaymentIntent completed = "automatic".equals(intent.getCaptureMethod())
                ? intent.toBuilder().status(StripePaymentIntent.SUCCEEDED).amountReceived(intent.getAmount()).build()
                : intent.toBuilder().status(StripePaymentIntent.REQUIRES_CAPTURE).build();
        intents.put(paymentIntentId, completed);
        return completed.getStatus();
    }

    @Override
    public SetupIntentResult createSetupIntent(String customerId, String idempotencyKey, Duration timeout) {
        return replay(setupIntentResponses, idempotencyKey, () -> {
            String id = "seti_" + randomId();
            return SetupIntentResult.builder()
                    .success(true)
                    .setupIntentId(id)
                    .clientSecret(id + "_secret_" + randomId())
                    .status(StripePaymentIntent.REQUIRES_PAYMENT_METHOD)
                    .build();
        });
    }

    @Override
    public TerminalResult registerTerminal(TerminalPairingRequest request, Duration timeout) {
        if (request.getRegistrationCode() == null || request.getRegistrationCode().isBlank()) {
            return TerminalResult.failure("parameter_missing", "registration_code is required");
        }
        return TerminalResult.builder()
                .success(true)
                .terminalId("tmr_" + randomId())
                .deviceType("bbpos_wisepos_e")
                .serialNumber("WSC513" + request.getRegistrationCode().toUpperCase(Locale.ROOT))
                .status("online")
                .build();
    }

    @Override
    public ConnectionTokenResult createConnectionToken(String locationId, Duration timeout) {
        return ConnectionTokenResult.builder()
                .success(true)
                .secret("pst_test_" + randomId())
                .build();
    }

    /**
     * Header format {@code t=<unix seconds>,v1=<hex hmac>}; the signed content is
     * {@code "<t>.<payload>"}. Timestamps older than five minutes are rejected.
     */
    @Override
    public boolean verifyWebhookSignature(String payload, String signature, String secret) {
        if (payload == null || signature == null || secret == null || secret.isBlank()) {
            return false;
        }
        String timestamp = null;
        String v1 = null;
        for (String part : signature.split(",")) {
            String[] kv = part.trim().split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            if ("t".equals(kv[0])) {
                timestamp = kv[1];
            } else if ("v1".equals(kv[0]) && v1 == null) {
                v1 = kv[1];
            }
        }
        if (timestamp == null || v1 == null) {
            return false;
        }
        long signedAt;
        try {
            signedAt = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            return false;
        }
        if (Math.abs(clock.instant().getEpochSecond() - signedAt) > SIGNATURE_TOLERANCE_SECONDS) {
            log.warn("Stripe webhook signature timestamp {} outside tolerance", signedAt);
            return false;
        }
        String expected = WebhookSignatures.hmacSha256Hex(secret.getBytes(StandardCharsets.UTF_8), timestamp + "." + payload);
        return WebhookSignatures.constantTimeEquals(expected, v1);
    }

    @Override
    public List<WebhookNotification> parseWebhook(String payload) {
        return mapper.parseEvent(payload);
    }

    @Override
    public WebhookEventKind classifyWebhookEvent(String eventType, String rawPayload) {
        return mapper.classify(eventType);
    }

    private StripePaymentIntent newIntent(ProviderPaymentRequest request) {
        String id = "pi_" + randomId();
        StripePaymentIntent.StripePaymentIntentBuilder intent = StripePaymentIntent.builder()
                .id(id)
                .amount(request.getAmount())
                .currency(request.getCurrency().toLowerCase(Locale.ROOT))
                .captureMethod(request.isCaptureAutomatically() ? "automatic" : "manual")
                .clientSecret(id + "_secret_" + randomId())
                .transferDestination(request.getConnectedAccountId())
                .applicationFeeAmount(request.getApplicationFee());

        String token = request.getPaymentMethodToken() != null ? request.getPaymentMethodToken() : "";
        if (request.getAmount() >= DECLINE_AMOUNT_THRESHOLD || "pm_card_chargeDeclined".equals(token)) {
            return intent.status(StripePaymentIntent.REQUIRES_PAYMENT_METHOD)
                    .lastPaymentError(StripeError.builder().type("card_error").code("card_declined")
                            .declineCode("generic_decline").message("Your card was declined.").build())
                    .build();
        }
        if ("pm_card_insufficientFunds".equals(token)) {
            return intent.status(StripePaymentIntent.REQUIRES_PAYMENT_METHOD)
                    .lastPaymentError(StripeError.builder().type("card_error").code("card_declined")
                            .declineCode("insufficient_funds").message("Your card has insufficient funds.").build())
                    .build();
        }
        if ("pm_card_chargeDeclinedProcessingError".equals(token)) {
            return intent.status(StripePaymentIntent.REQUIRES_PAYMENT_METHOD)
                    .lastPaymentError(StripeError.builder().type("card_error").code("processing_error")
                            .message("An error occurred while processing your card. Try again in a little bit.").build())
                    .build();
        }
        if ("pm_card_threeDSecureRequired".equals(token)) {
            return intent.status(StripePaymentIntent.REQUIRES_ACTION)
                    .nextActionType("redirect_to_url")
                    .nextActionUrl("https://hooks.stripe.com/3d_secure_2/hosted?payment_intent=" + id)
                    .build();
        }
        if ("pm_card_processing".equals(token)) {
            return intent.status(StripePaymentIntent.PROCESSING).build();
        }
        String chargeId = "ch_" + randomId();
        if (request.isCaptureAutomatically()) {
            return intent.status(StripePaymentIntent.SUCCEEDED).amountReceived(request.getAmount()).latestCharge(chargeId).build();
        }
        return intent.status(StripePaymentIntent.REQUIRES_CAPTURE).latestCharge(chargeId).build();
    }

    /** A repeated idempotency key gets the first response back, as Stripe does for 24 hours. */
    private static <T> T replay(Map<String, T> responses, String idempotencyKey, Supplier<T> operation) {
        if (idempotencyKey == null) {
            return operation.get();
        }
        return responses.computeIfAbsent(idempotencyKey, k -> operation.get());
    }

    private static StripeError missing(String reference) {
        return StripeError.builder().type("invalid_request_error").code("resource_missing")
                .message("No such payment_intent: '" + reference + "'").build();
    }

    private static StripeError unexpectedState(StripePaymentIntent intent, String pastTense) {
        return StripeError.builder().type("invalid_request_error").code("payment_intent_unexpected_state")
                .message("This PaymentIntent could not be " + pastTense + " because it has a status of " + intent.getStatus() + ".")
                .build();
    }

    private static String randomId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}

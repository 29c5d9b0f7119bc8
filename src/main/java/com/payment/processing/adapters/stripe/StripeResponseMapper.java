package com.payment.processing.adapters.stripe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.processing.domain.NextAction;
import com.payment.processing.domain.WebhookEventKind;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.domain.provider.ProviderPaymentStatus;
import com.payment.processing.domain.provider.ProviderResult;

import java.io.IOException;
import java.util.List;

/**
 * Translates Stripe's vocabulary into normalized results. Nothing outside this
 * class interprets a Stripe status string or event type.
 */
public class StripeResponseMapper {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ProviderResult toResult(StripePaymentIntent intent) {
        StripeError error = intent.getLastPaymentError();
        switch (intent.getStatus()) {
            case StripePaymentIntent.REQUIRES_ACTION:
                return ok(intent, ProviderPaymentStatus.REQUIRES_ACTION, intent.getAmount())
                        .nextAction(NextAction.builder()
                                .type(intent.getNextActionType())
                                .redirectUrl(intent.getNextActionUrl())
                                .clientSecret(intent.getClientSecret())
                                .build())
                        .build();
            case StripePaymentIntent.PROCESSING:
                return ok(intent, ProviderPaymentStatus.PENDING, intent.getAmount()).build();
            case StripePaymentIntent.REQUIRES_CAPTURE:
                return ok(intent, ProviderPaymentStatus.AUTHORIZED, intent.getAmount()).build();
            case StripePaymentIntent.SUCCEEDED:
                return ok(intent, ProviderPaymentStatus.CAPTURED,
                        intent.getAmountReceived() > 0 ? intent.getAmountReceived() : intent.getAmount()).build();
            case StripePaymentIntent.CANCELED:
                return ProviderResult.builder()
                        .success(false)
                        .reference(intent.getId())
                        .status(ProviderPaymentStatus.CANCELED)
                        .errorCode("payment_intent_canceled")
                        .errorMessage("Payment intent was canceled")
                        .build();
            case StripePaymentIntent.REQUIRES_PAYMENT_METHOD:
            default:
                return ProviderResult.builder()
                        .success(false)
                        .reference(intent.getId())
                        .status(ProviderPaymentStatus.DECLINED)
                        .errorCode(errorCode(error))
                        .errorMessage(error != null ? error.getMessage() : "Payment method required")
                        .build();
        }
    }

    public ProviderResult toCancellationResult(StripePaymentIntent intent) {
        if (!StripePaymentIntent.CANCELED.equals(intent.getStatus())) {
            return ProviderResult.rejected("payment_intent_unexpected_state",
                    "Payment intent " + intent.getId() + " is " + intent.getStatus());
        }
        return ProviderResult.builder()
                .success(true)
                .reference(intent.getId())
                .status(ProviderPaymentStatus.CANCELED)
                .build();
    }

    public ProviderResult toResult(StripeRefund refund) {
        if (refund.getError() != null || "failed".equals(refund.getStatus()) || "canceled".equals(refund.getStatus())) {
            StripeError error = refund.getError();
            return ProviderResult.builder()
                    .success(false)
                    .reference(refund.getId())
                    .status(ProviderPaymentStatus.DECLINED)
                    .errorCode(errorCode(error))
                    .errorMessage(error != null ? error.getMessage() : "Refund " + refund.getStatus())
                    .build();
        }
        return ProviderResult.builder()
                .success(true)
                .reference(refund.getId())
                .status(ProviderPaymentStatus.REFUNDED)
                .amount(refund.getAmount())
                .build();
    }

    /** API-level failure (bad request, unexpected state, rate limit). */
    public ProviderResult toResult(StripeError error) {
        return ProviderResult.rejected(errorCode(error), error.getMessage());
    }

    public WebhookEventKind classify(String eventType) {
        if (eventType == null) {
            return WebhookEventKind.UNKNOWN;
        }
        switch (eventType) {
            case "payment_intent.succeeded":
            case "payment_intent.amount_capturable_updated":
                return WebhookEventKind.AUTHORIZATION_SUCCEEDED;
            case "payment_intent.payment_failed":
                return WebhookEventKind.AUTHORIZATION_FAILED;
            case "charge.captured":
                return WebhookEventKind.CAPTURED;
            case "payment_intent.canceled":
                return WebhookEventKind.CANCELED;
            case "charge.refunded":
                return WebhookEventKind.REFUNDED;
            case "charge.dispute.created":
                return WebhookEventKind.CHARGEBACK;
            default:
                return WebhookEventKind.UNKNOWN;
        }
    }

    /**
     * Stripe sends one event per delivery. Charge and dispute objects point back
     * at their payment intent, which is the reference attempts are indexed by.
     */
    public List<WebhookNotification> parseEvent(String payload) {
        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("Stripe webhook body is not JSON", e);
        }
        String type = event.path("type").asText(null);
        JsonNode object = event.path("data").path("object");
        if (type == null || object.isMissingNode()) {
            throw new IllegalArgumentException("Stripe webhook body has no type or data.object");
        }
        String reference = object.hasNonNull("payment_intent")
                ? object.get("payment_intent").asText()
                : object.path("id").asText(null);
        return List.of(WebhookNotification.builder()
                .eventType(type)
                .providerReference(reference)
                .rawPayload(payload)
                .build());
    }


    private static ProviderResult.ProviderResultBuilder ok(StripePaymentIntent intent, ProviderPaymentStatus status, long amount) {
        return ProviderResult.builder()
                .success(true)
                .reference(intent.getId())
                .status(status)
                .amount(amount)
                .networkTransactionId(intent.getLatestCharge());
    }

    private static String errorCode(StripeError error) {
        if (error == null) {
            return "card_declined";
        }
        if (error.getDeclineCode() != null && !"generic_decline".equals(error.getDeclineCode())) {
            return error.getDeclineCode();
        }
        return error.getCode() != null ? error.getCode() : error.getType();
    }
}

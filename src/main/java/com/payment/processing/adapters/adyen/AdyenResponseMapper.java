package com.payment.processing.adapters.adyen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.processing.domain.NextAction;
import com.payment.processing.domain.WebhookEventKind;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.domain.provider.ProviderPaymentStatus;
import com.payment.processing.domain.provider.ProviderResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates Adyen result codes, modification acknowledgements and
 * notification items into normalized results.
 */
public class AdyenResponseMapper {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param capturedImmediately the payment was sent without delayed capture,
     *                            so {@code Authorised} also means captured
     */
    public ProviderResult toResult(AdyenPaymentResponse response, boolean capturedImmediately) {
        String resultCode = response.getResultCode() != null ? response.getResultCode() : "";
        switch (resultCode) {
            case "Authorised":
                return ProviderResult.builder()
                        .success(true)
                        .reference(response.getPspReference())
                        .status(capturedImmediately ? ProviderPaymentStatus.CAPTURED : ProviderPaymentStatus.AUTHORIZED)
                        .amount(response.getAmountValue())
                        .authorizationCode(response.getAuthCode())
                        .build();
            case "RedirectShopper":
            case "IdentifyShopper":
            case "ChallengeShopper":
                return ProviderResult.builder()
                        .success(true)
                        .reference(response.getPspReference())
                        .status(ProviderPaymentStatus.REQUIRES_ACTION)
                        .amount(response.getAmountValue())
                        .nextAction(NextAction.builder()
                                .type(response.getActionType())
                                .redirectUrl(response.getActionUrl())
                                .data(response.getPaymentData() != null ? Map.of("paymentData", response.getPaymentData()) : null)
                                .build())
                        .build();
            case "Pending":
            case "Received":
                return ProviderResult.builder()
                        .success(true)
                        .reference(response.getPspReference())
                        .status(ProviderPaymentStatus.PENDING)
                        .amount(response.getAmountValue())
                        .build();
            case "Refused":
                return ProviderResult.builder()
                        .success(false)
                        .reference(response.getPspReference())
                        .status(ProviderPaymentStatus.DECLINED)
                        .errorCode(response.getRefusalReason() != null ? response.getRefusalReason() : "Refused")
                        .errorMessage("Payment refused: " + response.getRefusalReason())
                        .build();
            case "Cancelled":
                return ProviderResult.builder()
                        .success(false)
                        .reference(response.getPspReference())
                        .status(ProviderPaymentStatus.CANCELED)
                        .errorCode("Cancelled")
                        .errorMessage("Payment was cancelled")
                        .build();
            case "Error":
                return ProviderResult.builder()
                        .success(false)
                        .reference(response.getPspReference())
                        .status(ProviderPaymentStatus.DECLINED)
                        .errorCode(response.getRefusalReason() != null ? response.getRefusalReason() : "Error")
                        .errorMessage("Payment error: " + response.getRefusalReason())
                        .build();
            default:
                return ProviderResult.rejected("unknown_result_code", "Unexpected Adyen result code '" + resultCode + "'");
        }
    }

    public ProviderResult toResult(AdyenModificationResponse response, ProviderPaymentStatus statusWhenReceived) {
        if (response.getResponse() != null && response.getResponse().endsWith("-received]")) {
            return ProviderResult.builder()
                    .success(true)
                    .reference(response.getPspReference())
                    .status(statusWhenReceived)
                    .amount(response.getAmountValue())
                    .build();
        }
        return ProviderResult.rejected(
                response.getErrorCode() != null ? response.getErrorCode() : "modification_rejected",
                response.getMessage());
    }

    /**
     * AUTHORISATION carries its outcome in the item's {@code success} flag.
     */
    public WebhookEventKind classify(String eventCode, String rawItem) {
        if (eventCode == null) {
            return WebhookEventKind.UNKNOWN;
        }
        switch (eventCode) {
            case "AUTHORISATION":
                return isSuccess(rawItem) ? WebhookEventKind.AUTHORIZATION_SUCCEEDED : WebhookEventKind.AUTHORIZATION_FAILED;
            case "CAPTURE":
                return isSuccess(rawItem) ? WebhookEventKind.CAPTURED : WebhookEventKind.UNKNOWN;
            case "CANCELLATION":
                return isSuccess(rawItem) ? WebhookEventKind.CANCELED : WebhookEventKind.UNKNOWN;
            case "REFUND":
                return WebhookEventKind.REFUNDED;
            case "CHARGEBACK":
                return WebhookEventKind.CHARGEBACK;
            default:
                return WebhookEventKind.UNKNOWN;
        }
    }

    /**
     * One Adyen delivery batches several {@code NotificationRequestItem}s.
     * Modifications reference the payment through {@code originalReference}.
     */
    public List<WebhookNotification> parseNotifications(String payload) {
        JsonNode root = readTree(payload);
        JsonNode items = root.path("notificationItems");
        if (!items.isArray()) {
            throw new IllegalArgumentException("Adyen webhook body has no notificationItems");
        }
        List<WebhookNotification> notifications = new ArrayList<>();
        for (JsonNode wrapper : items) {
            JsonNode item = wrapper.path("NotificationRequestItem");
            if (item.isMissingNode()) {
                continue;
            }
            String reference = item.hasNonNull("originalReference")
                    ? item.get("originalReference").asText()
                    : item.path("pspReference").asText(null);
            notifications.add(WebhookNotification.builder()
                    .eventType(item.path("eventCode").asText(null))
                    .providerReference(reference)
                    .rawPayload(item.toString())
                    .build());
        }
        return notifications;
    }

    private boolean isSuccess(String rawItem) {
        if (rawItem == null) {
            return false;
        }
        return readTree(rawItem).path("success").asText("false").equalsIgnoreCase("true");
    }

    private JsonNode readTree(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("Adyen webhook body is not JSON", e);
        }
    }
}

package com.payment.processing.adapters.adyen;

import com.payment.processing.adapters.WebhookSignatures;
import com.payment.processing.core.ProviderClient;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.SplitAllocation;
import com.payment.processing.domain.WebhookEventKind;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.domain.provider.ProviderPaymentRequest;
import com.payment.processing.domain.provider.ProviderPaymentStatus;
import com.payment.processing.domain.provider.ProviderResult;
import com.payment.processing.domain.provider.TerminalPairingRequest;
import com.payment.processing.domain.provider.TerminalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Sandbox Adyen. Answers with Adyen result codes and modification
 * acknowledgements, normalized by {@link AdyenResponseMapper}. Repeated
 * requests with the same idempotency key replay the first response.
 * <p>
 * Test payment methods: {@code scheme_3ds} (RedirectShopper), {@code scheme_pending}
 * (Pending), {@code scheme_refused} (Refused), {@code scheme_acquirer_error}
 * (Error / Acquirer Error, retryable). Amounts of 99,999,900 minor units or more are refused.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.processing.providers.adyen.sandbox", havingValue = "true", matchIfMissing = true)
public class MockAdyenClient implements ProviderClient {

    static final long REFUSE_AMOUNT_THRESHOLD = 99_999_900L;

    private final AdyenResponseMapper mapper = new AdyenResponseMapper();
    private final Map<String, SandboxPayment> payments = new ConcurrentHashMap<>();
    private final Map<String, AdyenPaymentResponse> paymentResponses = new ConcurrentHashMap<>();
    private final Map<String, AdyenModificationResponse> modificationResponses = new ConcurrentHashMap<>();
    private final String merchantAccount;

    public MockAdyenClient(@Value("${payment.processing.providers.adyen.merchant-account:HospitalityECOM}") String merchantAccount) {
        this.merchantAccount = merchantAccount;
    }

    @Override
    public ProcessorName getProcessor() {
        return ProcessorName.ADYEN;
    }

    @Override
    public ProviderResult createPayment(ProviderPaymentRequest request, String idempotencyKey, Duration timeout) {
        AdyenPaymentResponse response = replay(paymentResponses, idempotencyKey, () -> authorise(request));
        log.debug("MockAdyenClient payment {} resultCode={} merchantAccount={} reference={}",
                response.getPspReference(), response.getResultCode(), merchantAccount, response.getMerchantReference());
        return mapper.toResult(response, request.isCaptureAutomatically());
    }

    @Override
    public ProviderResult createSplitPayment(ProviderPaymentRequest request, List<SplitAllocation> splits,
                                             String idempotencyKey, Duration timeout) {
        long total = splits.stream().mapToLong(SplitAllocation::getAmount).sum();
        if (total != request.getAmount()) {
            return ProviderResult.rejected("validation_error", "Split amounts do not add up to the payment amount");
        }
        return createPayment(request, idempotencyKey, timeout);
    }

    @Override
    public ProviderResult capture(String reference, long amount, String currency, String idempotencyKey, Duration timeout) {
        AdyenModificationResponse response = replay(modificationResponses, idempotencyKey, () -> {
            SandboxPayment payment = payments.get(reference);
            if (payment == null) {
                return unknownPayment(reference);
            }
            synchronized (payment) {
                if (!"Authorised".equals(payment.resultCode) || payment.captured > 0 || amount > payment.amount) {
                    return rejectedModification(reference, "167", "Original pspReference required for this operation");
                }
                payment.captured = amount;
            }
            return received(reference, AdyenModificationResponse.CAPTURE_RECEIVED, amount);
        });
        return mapper.toResult(response, ProviderPaymentStatus.CAPTURED);
    }

    @Override
    public ProviderResult refund(String reference, long amount, String currency, String reason,
                                 String idempotencyKey, Duration timeout) {
        AdyenModificationResponse response = replay(modificationResponses, idempotencyKey, () -> {
            SandboxPayment payment = payments.get(reference);
            if (payment == null) {
                return unknownPayment(reference);
            }
            synchronized (payment) {
                if (payment.refunded + amount > payment.captured) {
                    return rejectedModification(reference, "137", "Invalid amount specified");
                }
                payment.refunded += amount;
            }
            return received(reference, AdyenModificationResponse.REFUND_RECEIVED, amount);
        });
        return mapper.toResult(response, ProviderPaymentStatus.REFUNDED);
    }

    @Override
    public ProviderResult cancel(String reference, String reason, String idempotencyKey, Duration timeout) {
        AdyenModificationResponse response = replay(modificationResponses, idempotencyKey, () -> {
            SandboxPayment payment = payments.get(reference);
            if (payment == null) {
                return unknownPayment(reference);
            }
            synchronized (payment) {
                if (payment.captured > 0) {
                    return rejectedModification(reference, "167", "Payment already captured");
                }
                payment.resultCode = "Cancelled";
            }
            return received(reference, AdyenModificationResponse.CANCEL_RECEIVED, 0);
        });
        return mapper.toResult(response, ProviderPaymentStatus.CANCELED);
    }

    @Override
    public TerminalResult registerTerminal(TerminalPairingRequest request, Duration timeout) {
        if (request.getTerminalId() == null || request.getTerminalId().isBlank()) {
            return TerminalResult.failure("validation_error", "terminalId is required");
        }
        String serial = request.getTerminalId().contains("-")
                ? request.getTerminalId().substring(request.getTerminalId().indexOf('-') + 1)
                : request.getTerminalId();
        return TerminalResult.builder()
                .success(true)
                .terminalId(request.getTerminalId())
                .deviceType("V400m")
                .serialNumber(serial)
                .status(request.getStoreId() != null ? "AssignedToStore" : "AssignedToMerchantAccount")
                .build();
    }

    /**
     * {@code signature} is base64(HMAC-SHA256(payload)) under the hex-encoded key
     * configured in the Customer Area.
     */
    @Override
    public boolean verifyWebhookSignature(String payload, String signature, String secret) {
        if (payload == null || signature == null || secret == null || secret.isBlank()) {
            return false;
        }
        byte[] key;
        try {
            key = HexFormat.of().parseHex(secret);
        } catch (IllegalArgumentException e) {
            log.error("Adyen HMAC key is not hex-encoded; rejecting webhook");
            return false;
        }
        String expected = WebhookSignatures.hmacSha256Base64(key, payload);
        return WebhookSignatures.constantTimeEquals(expected, signature.trim());
    }

    @Override
    public List<WebhookNotification> parseWebhook(String payload) {
        return mapper.parseNotifications(payload);
    }

    @Override
    public WebhookEventKind classifyWebhookEvent(String eventType, String rawPayload) {
        return mapper.classify(eventType, rawPayload);
    }

    private AdyenPaymentResponse authorise(ProviderPaymentRequest request) {
        String pspReference = newPspReference();
        String token = request.getPaymentMethodToken() != null ? request.getPaymentMethodToken() : "";
        AdyenPaymentResponse.AdyenPaymentResponseBuilder response = AdyenPaymentResponse.builder()
                .pspReference(pspReference)
                .merchantReference(request.getReference())
                .amountValue(request.getAmount())
                .amountCurrency(request.getCurrency());

        AdyenPaymentResponse result;
        if (request.getAmount() >= REFUSE_AMOUNT_THRESHOLD || "scheme_refused".equals(token)) {
            result = response.resultCode("Refused").refusalReason("Refused").refusalReasonCode("2").build();
        } else if ("scheme_acquirer_error".equals(token)) {
            result = response.resultCode("Error").refusalReason("Acquirer Error").refusalReasonCode("4").build();
        } else if ("scheme_3ds".equals(token)) {
            result = response.resultCode("RedirectShopper")
                    .actionType("redirect")
                    .actionUrl("https://checkoutshopper-test.adyen.com/checkoutshopper/threeDS/redirect?psp=" + pspReference)
                    .paymentData("Ab02b4c0!" + UUID.randomUUID())
                    .build();
        } else if ("scheme_pending".equals(token)) {
            result = response.resultCode("Pending").build();
        } else {
            result = response.resultCode("Authorised").authCode(String.valueOf(100000 + (pspReference.hashCode() & 0x7ffff) % 900000)).build();
        }

        SandboxPayment payment = new SandboxPayment(request.getAmount(), result.getResultCode());
        if ("Authorised".equals(result.getResultCode()) && request.isCaptureAutomatically()) {
            payment.captured = request.getAmount();
        }
        payments.put(pspReference, payment);
        return result;
    }

    private static <T> T replay(Map<String, T> responses, String idempotencyKey, Supplier<T> operation) {
        if (idempotencyKey == null) {
            return operation.get();
        }
        return responses.computeIfAbsent(idempotencyKey, k -> operation.get());
    }

    private static AdyenModificationResponse received(String paymentReference, String response, long amount) {
        return AdyenModificationResponse.builder()
                .pspReference(newPspReference())
                .paymentPspReference(paymentReference)
                .response(response)
                .amountValue(amount)
                .build();
    }

    private static AdyenModificationResponse unknownPayment(String reference) {
        return rejectedModification(reference, "167", "Original pspReference required for this operation");
    }

    private static AdyenModificationResponse rejectedModification(String reference, String errorCode, String message) {
        return AdyenModificationResponse.builder()
                .paymentPspReference(reference)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    private static String newPspReference() {
        return String.valueOf(Math.abs(UUID.randomUUID().getMostSignificantBits()) % 10_000_000_000_000_000L);
    }

    private static final class SandboxPayment {
        private final long amount;
        private String resultCode;
        private long captured;
        private long refunded;

        private SandboxPayment(long amount, String resultCode) {
            this.amount = amount;
            this.resultCode = resultCode;
        }
    }
}

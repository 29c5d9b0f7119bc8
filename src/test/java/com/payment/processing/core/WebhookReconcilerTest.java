package com.payment.processing.core;

import com.payment.processing.TestClock;
import com.payment.processing.adapters.WebhookSignatures;
import com.payment.processing.adapters.adyen.MockAdyenClient;
import com.payment.processing.adapters.stripe.MockStripeClient;
import com.payment.processing.core.actor.ProcessorActor;
import com.payment.processing.core.actor.ProcessorActorRegistry;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.persistence.service.AttemptStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookReconcilerTest {

    private static final String STRIPE_SECRET = "whsec_test_secret";
    private static final String ADYEN_HMAC_KEY = "44782DEF547AAA06C910C43932B1EB0C71FC68D9D0C057550C48EC2ACF6BA056";
    private static final UUID ORG = UUID.fromString("c3e1a7b2-4d5f-4e6a-8b9c-0d1e2f3a4b5c");

    @Mock
    private AttemptStore store;

    @Mock
    private ProcessorActorRegistry registry;

    @Mock
    private ProcessorActor actor;

    private TestClock clock;
    private WebhookReconciler reconciler;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2026-03-01T12:00:00Z"));
        reconciler = new WebhookReconciler(
                List.of(new MockStripeClient(clock), new MockAdyenClient("HospitalityECOM")),
                store, registry, STRIPE_SECRET, ADYEN_HMAC_KEY);
    }

    @Test
    void validStripeEventIsRoutedToOwningActor() {
        AttemptKey key = AttemptKey.of(ORG, ProcessorName.STRIPE, UUID.randomUUID());
        String payload = stripeEvent("charge.captured", "ch_1", "pi_abc");
        when(store.findByProviderReference(ProcessorName.STRIPE, "pi_abc")).thenReturn(Optional.of(key));
        routeToActor(key);
        when(actor.handleWebhook(any())).thenReturn(CompletableFuture.completedFuture(null));

        WebhookReceipt receipt = reconciler.reconcile(ProcessorName.STRIPE, payload, stripeSignature(payload));

        assertThat(receipt.getReceived()).isEqualTo(1);
        assertThat(receipt.getDispatched()).isEqualTo(1);
        assertThat(receipt.getCompletion()).isCompleted();
        ArgumentCaptor<WebhookNotification> notification = ArgumentCaptor.forClass(WebhookNotification.class);
        verify(actor).handleWebhook(notification.capture());
        assertThat(notification.getValue().getEventType()).isEqualTo("charge.captured");
        assertThat(notification.getValue().getProviderReference()).isEqualTo("pi_abc");
    }

    @Test
    void badSignatureIsRejectedBeforeAnyRouting() {
        String payload = stripeEvent("charge.captured", "ch_1", "pi_abc");

        assertThatThrownBy(() -> reconciler.reconcile(ProcessorName.STRIPE, payload, "t=1,v1=deadbeef"))
                .isInstanceOf(InvalidWebhookSignatureException.class);
        verifyNoInteractions(store, registry);
    }

    @Test
    void missingSignatureIsRejected() {
        assertThatThrownBy(() -> reconciler.reconcile(ProcessorName.STRIPE, "{}", null))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    void staleStripeTimestampIsRejected() {
        String payload = stripeEvent("charge.captured", "ch_1", "pi_abc");
        String signature = stripeSignature(payload);
        clock.advance(Duration.ofMinutes(6));

        assertThatThrownBy(() -> reconciler.reconcile(ProcessorName.STRIPE, payload, signature))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    void unconfiguredSecretRejectsEverything() {
        WebhookReconciler unconfigured = new WebhookReconciler(List.of(new MockStripeClient(clock)),
                store, registry, "", "");
        String payload = stripeEvent("charge.captured", "ch_1", "pi_abc");

        assertThatThrownBy(() -> unconfigured.reconcile(ProcessorName.STRIPE, payload, stripeSignature(payload)))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    void unknownReferenceIsAcknowledgedWithoutDispatch() {
        String payload = stripeEvent("payment_intent.succeeded", "pi_unknown", null);
        when(store.findByProviderReference(ProcessorName.STRIPE, "pi_unknown")).thenReturn(Optional.empty());

        WebhookReceipt receipt = reconciler.reconcile(ProcessorName.STRIPE, payload, stripeSignature(payload));

        assertThat(receipt.getReceived()).isEqualTo(1);
        assertThat(receipt.getDispatched()).isZero();
        verifyNoInteractions(registry);
    }

    @Test
    void adyenBatchDispatchesEachKnownItem() {
        AttemptKey known = AttemptKey.of(ORG, ProcessorName.ADYEN, UUID.randomUUID());
        String payload = "{\"live\":\"false\",\"notificationItems\":["
                + "{\"NotificationRequestItem\":{\"eventCode\":\"AUTHORISATION\",\"pspReference\":\"8815\",\"success\":\"true\"}},"
                + "{\"NotificationRequestItem\":{\"eventCode\":\"REFUND\",\"pspReference\":\"9915\",\"originalReference\":\"7715\",\"success\":\"true\"}}"
                + "]}";
        when(store.findByProviderReference(ProcessorName.ADYEN, "8815")).thenReturn(Optional.of(known));
        when(store.findByProviderReference(ProcessorName.ADYEN, "7715")).thenReturn(Optional.empty());
        routeToActor(known);
        when(actor.handleWebhook(any())).thenReturn(CompletableFuture.completedFuture(null));

        WebhookReceipt receipt = reconciler.reconcile(ProcessorName.ADYEN, payload, adyenSignature(payload));

        assertThat(receipt.getReceived()).isEqualTo(2);
        assertThat(receipt.getDispatched()).isEqualTo(1);
    }

    @Test
    void malformedBodyIsRejected() {
        String payload = "{\"notificationItems\":\"nope\"}";

        assertThatThrownBy(() -> reconciler.reconcile(ProcessorName.ADYEN, payload, adyenSignature(payload)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @SuppressWarnings("unchecked")
    private void routeToActor(AttemptKey key) {
        when(registry.ask(eq(key), any(Function.class)))
                .thenAnswer(invocation -> ((Function<ProcessorActor, Object>) invocation.getArgument(1)).apply(actor));
    }

    private String stripeSignature(String payload) {
        long timestamp = clock.instant().getEpochSecond();
        String v1 = WebhookSignatures.hmacSha256Hex(STRIPE_SECRET.getBytes(StandardCharsets.UTF_8), timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + v1;
    }

    private static String adyenSignature(String payload) {
        return WebhookSignatures.hmacSha256Base64(HexFormat.of().parseHex(ADYEN_HMAC_KEY), payload);
    }

    private static String stripeEvent(String type, String objectId, String paymentIntent) {
        String object = "{\"id\":\"" + objectId + "\""
                + (paymentIntent != null ? ",\"payment_intent\":\"" + paymentIntent + "\"" : "")
                + "}";
        return "{\"id\":\"evt_1\",\"type\":\"" + type + "\",\"data\":{\"object\":" + object + "}}";
    }
}

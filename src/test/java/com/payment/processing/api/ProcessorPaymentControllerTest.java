package com.payment.processing.api;

import com.payment.processing.core.actor.AttemptNotFoundException;
import com.payment.processing.core.actor.ProcessorActor;
import com.payment.processing.core.actor.ProcessorActorRegistry;
import com.payment.processing.core.actor.StripeProcessorActor;
import com.payment.processing.core.idempotency.RequestIdempotencyService;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.AttemptStatus;
import com.payment.processing.domain.AuthorizationRequest;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.ProcessorResult;
import com.payment.processing.domain.provider.SetupIntentResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for ProcessorPaymentController using MockMvc.
 */
@WebMvcTest(controllers = ProcessorPaymentController.class)
class ProcessorPaymentControllerTest {

    private static final UUID ORG = UUID.fromString("9b2f6c1e-3a4d-4f5e-8c7b-6a5d4e3f2c1b");
    private static final UUID PAYMENT_INTENT = UUID.fromString("1c2d3e4f-5a6b-4c7d-8e9f-0a1b2c3d4e5f");
    private static final String BASE = "/api/v1/orgs/" + ORG + "/processors/stripe/payments";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProcessorActorRegistry registry;

    @MockitoBean
    private RequestIdempotencyService idempotencyService;

    private final StripeProcessorActor actor = mock(StripeProcessorActor.class);

    @Test
    void authorizeReturnsActorResult() throws Exception {
        routeToActor();
        when(actor.authorize(any())).thenReturn(ProcessorResult.builder()
                .success(true)
                .status(AttemptStatus.CAPTURED)
                .transactionId("pi_123")
                .authorizationCode("A1B2C3")
                .amount(1500L)
                .build());

        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "paymentIntentId": "%s",
                                  "amount": 1500,
                                  "currency": "usd",
                                  "paymentMethodToken": "pm_card_visa"
                                }
                                """.formatted(PAYMENT_INTENT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paymentIntentId").value(PAYMENT_INTENT.toString()))
                .andExpect(jsonPath("$.processor").value("stripe"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("captured"))
                .andExpect(jsonPath("$.transactionId").value("pi_123"))
                .andExpect(jsonPath("$.amount").value(1500));

        ArgumentCaptor<AuthorizationRequest> request = ArgumentCaptor.forClass(AuthorizationRequest.class);
        verify(actor).authorize(request.capture());
        assertThat(request.getValue().getAmount()).isEqualTo(1500);
        assertThat(request.getValue().isCaptureAutomatically()).isTrue();
        verifyNoInteractions(idempotencyService);
    }

    @Test
    void declineIsReturnedAsOkWithErrorCode() throws Exception {
        routeToActor();
        when(actor.authorize(any())).thenReturn(ProcessorResult.failure(AttemptStatus.FAILED, "card_declined", "Your card was declined."));

        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 1500, \"currency\": \"usd\", \"paymentMethodToken\": \"pm_card_chargeDeclined\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.errorCode").value("card_declined"));
    }

    @Test
    void idempotencyKeyIsAcquiredAndMarked() throws Exception {
        routeToActor();
        ProcessorResult result = ProcessorResult.builder().success(true).status(AttemptStatus.AUTHORIZED).transactionId("pi_1").build();
        when(actor.authorize(any())).thenReturn(result);
        when(idempotencyService.tryAcquire(eq(ORG), eq("req-1"), eq("authorize"), eq(PAYMENT_INTENT), isNull())).thenReturn(true);
        when(idempotencyService.computeResultHash(result)).thenReturn("00aa11bb22cc33dd");

        mockMvc.perform(post(BASE)
                        .header("Idempotency-Key", "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentIntentId\": \"" + PAYMENT_INTENT + "\", \"amount\": 900, \"currency\": \"usd\","
                                + " \"captureAutomatically\": false}"))
                .andExpect(status().isOk());

        verify(idempotencyService).markKeyUsed(ORG, "req-1", true, "00aa11bb22cc33dd");
    }

    @Test
    void reusedIdempotencyKeyIsConflict() throws Exception {
        when(idempotencyService.tryAcquire(eq(ORG), eq("req-1"), anyString(), any(), any())).thenReturn(false);

        mockMvc.perform(post(BASE)
                        .header("Idempotency-Key", "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 900, \"currency\": \"usd\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_REQUEST"));

        verifyNoInteractions(registry);
        verify(idempotencyService, never()).markKeyUsed(any(), anyString(), anyBoolean(), any());
    }

    @Test
    void invalidBodyIsRejected() throws Exception {
        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": -5, \"currency\": \"dollars\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.amount").exists())
                .andExpect(jsonPath("$.details.currency").exists());
    }

    @Test
    void unknownProcessorIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/orgs/" + ORG + "/processors/paypal/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 900, \"currency\": \"usd\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void captureRoutesToOwningActor() throws Exception {
        routeToActor();
        when(actor.capture("pi_1", 700L)).thenReturn(ProcessorResult.builder()
                .success(true).status(AttemptStatus.CAPTURED).transactionId("pi_1").amount(700L).build());

        mockMvc.perform(post(BASE + "/" + PAYMENT_INTENT + "/capture")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\": \"pi_1\", \"amount\": 700}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("captured"))
                .andExpect(jsonPath("$.amount").value(700));

        ArgumentCaptor<AttemptKey> key = ArgumentCaptor.forClass(AttemptKey.class);
        verify(registry).ask(key.capture(), any(Function.class));
        assertThat(key.getValue()).isEqualTo(AttemptKey.of(ORG, ProcessorName.STRIPE, PAYMENT_INTENT));
    }

    @Test
    void refundRequiresAmount() throws Exception {
        mockMvc.perform(post(BASE + "/" + PAYMENT_INTENT + "/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\": \"pi_1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.amount").exists());
    }

    @Test
    void voidReturnsResult() throws Exception {
        routeToActor();
        when(actor.voidPayment("pi_1", "duplicate")).thenReturn(ProcessorResult.builder()
                .success(true).status(AttemptStatus.VOIDED).transactionId("pi_1").build());

        mockMvc.perform(post(BASE + "/" + PAYMENT_INTENT + "/void")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\": \"pi_1\", \"reason\": \"duplicate\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("voided"));
    }

    @Test
    void unknownPaymentIsNotFound() throws Exception {
        AttemptKey key = AttemptKey.of(ORG, ProcessorName.STRIPE, PAYMENT_INTENT);
        when(registry.ask(eq(key), any(Function.class))).thenThrow(new AttemptNotFoundException(key));

        mockMvc.perform(get(BASE + "/" + PAYMENT_INTENT))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("PAYMENT_NOT_FOUND"));
    }

    @Test
    void splitOnStripeIsBadRequest() throws Exception {
        when(registry.ask(any(AttemptKey.class), any(), any(Function.class)))
                .thenThrow(new IllegalArgumentException("Operation not supported by processor stripe"));

        mockMvc.perform(post(BASE + "/" + PAYMENT_INTENT + "/split")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "amount": 1000,
                                  "currency": "eur",
                                  "splits": [{"account": "AH1", "amount": 1000, "type": "MarketPlace"}]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Operation not supported by processor stripe"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void setupIntentReturnsClientSecret() throws Exception {
        when(registry.ask(any(AttemptKey.class), eq(StripeProcessorActor.class), any(Function.class)))
                .thenAnswer(invocation -> ((Function<StripeProcessorActor, Object>) invocation.getArgument(2)).apply(actor));
        when(actor.createSetupIntent("cus_42")).thenReturn(SetupIntentResult.builder()
                .success(true).setupIntentId("seti_1").clientSecret("seti_1_secret_x").status("requires_payment_method").build());

        mockMvc.perform(post(BASE + "/setup-intents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentIntentId\": \"" + PAYMENT_INTENT + "\", \"customerId\": \"cus_42\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.setupIntentId").value("seti_1"))
                .andExpect(jsonPath("$.clientSecret").value("seti_1_secret_x"));
    }

    @SuppressWarnings("unchecked")
    private void routeToActor() {
        when(registry.ask(any(AttemptKey.class), any(Function.class)))
                .thenAnswer(invocation -> ((Function<ProcessorActor, Object>) invocation.getArgument(1)).apply(actor));
    }
}

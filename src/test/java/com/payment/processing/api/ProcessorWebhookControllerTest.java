package com.payment.processing.api;

import com.payment.processing.core.InvalidWebhookSignatureException;
import com.payment.processing.core.WebhookReceipt;
import com.payment.processing.core.WebhookReconciler;
import com.payment.processing.domain.ProcessorName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ProcessorWebhookController.class)
class ProcessorWebhookControllerTest {

    private static final String STRIPE_EVENT =
            "{\"id\":\"evt_1\",\"type\":\"charge.captured\",\"data\":{\"object\":{\"id\":\"ch_1\",\"payment_intent\":\"pi_1\"}}}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookReconciler reconciler;

    @Test
    void stripeEventIsPassedThroughVerbatim() throws Exception {
        when(reconciler.reconcile(ProcessorName.STRIPE, STRIPE_EVENT, "t=1,v1=abc"))
                .thenReturn(new WebhookReceipt(1, 1, CompletableFuture.completedFuture(null)));

        mockMvc.perform(post("/api/v1/webhooks/processors/stripe")
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(STRIPE_EVENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.dispatched").value(1));
    }

    @Test
    void invalidSignatureIsBadRequest() throws Exception {
        when(reconciler.reconcile(eq(ProcessorName.STRIPE), any(), isNull()))
                .thenThrow(new InvalidWebhookSignatureException(ProcessorName.STRIPE, "Invalid stripe webhook signature"));

        mockMvc.perform(post("/api/v1/webhooks/processors/stripe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(STRIPE_EVENT))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_SIGNATURE"));
    }

    @Test
    void adyenNotificationIsAccepted() throws Exception {
        String payload = "{\"live\":\"false\",\"notificationItems\":[]}";
        when(reconciler.reconcile(ProcessorName.ADYEN, payload, "c2lnbmF0dXJl"))
                .thenReturn(new WebhookReceipt(0, 0, CompletableFuture.completedFuture(null)));

        mockMvc.perform(post("/api/v1/webhooks/processors/adyen")
                        .header("X-Adyen-Hmac-Signature", "c2lnbmF0dXJl")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(content().string("[accepted]"));

        verify(reconciler).reconcile(ProcessorName.ADYEN, payload, "c2lnbmF0dXJl");
    }

    @Test
    void malformedNotificationIsBadRequest() throws Exception {
        when(reconciler.reconcile(eq(ProcessorName.ADYEN), any(), any()))
                .thenThrow(new IllegalArgumentException("Adyen webhook body has no notificationItems"));

        mockMvc.perform(post("/api/v1/webhooks/processors/adyen")
                        .header("X-Adyen-Hmac-Signature", "x")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}

package com.payment.processing.api;

import com.payment.processing.core.WebhookReceipt;
import com.payment.processing.core.WebhookReconciler;
import com.payment.processing.domain.ProcessorName;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Webhook receivers. The raw body is kept as received since signatures are computed over it.
 * Notifications are acknowledged once routed, before the actors apply them.
 */
@RestController
@RequestMapping("/api/v1/webhooks/processors")
@RequiredArgsConstructor
@Tag(name = "Processor webhooks", description = "Asynchronous payment notifications from card networks")
public class ProcessorWebhookController {

    private final WebhookReconciler reconciler;

    @PostMapping("/stripe")
    @Operation(summary = "Stripe webhook", description = "Verified with the Stripe-Signature header.")
    public ResponseEntity<Map<String, Object>> stripe(@RequestBody String payload,
                                                      @RequestHeader(value = "Stripe-Signature", required = false) String signature) {
        WebhookReceipt receipt = reconciler.reconcile(ProcessorName.STRIPE, payload, signature);
        return ResponseEntity.ok(Map.of("received", true, "dispatched", receipt.getDispatched()));
    }

    @PostMapping("/adyen")
    @Operation(summary = "Adyen notification", description = "Verified with the X-Adyen-Hmac-Signature header. Answers [accepted].")
    public ResponseEntity<String> adyen(@RequestBody String payload,
                                        @RequestHeader(value = "X-Adyen-Hmac-Signature", required = false) String signature) {
        reconciler.reconcile(ProcessorName.ADYEN, payload, signature);
        return ResponseEntity.ok("[accepted]");
    }
}

package com.payment.processing.core;

import com.payment.processing.core.actor.ProcessorActorRegistry;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.persistence.service.AttemptStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for provider webhooks. Verifies the signature, splits the body
 * into notifications and routes each to the actor owning the referenced
 * payment. Routing does not wait for the actors to apply them.
 */
@Slf4j
@Service
public class WebhookReconciler {

    private final Map<ProcessorName, ProviderClient> clients = new EnumMap<>(ProcessorName.class);
    private final Map<ProcessorName, String> secrets = new EnumMap<>(ProcessorName.class);
    private final AttemptStore store;
    private final ProcessorActorRegistry registry;

    public WebhookReconciler(List<ProviderClient> providerClients,
                             AttemptStore store,
                             ProcessorActorRegistry registry,
                             @Value("${payment.processing.providers.stripe.webhook-secret:}") String stripeSecret,
                             @Value("${payment.processing.providers.adyen.hmac-key:}") String adyenHmacKey) {
        for (ProviderClient client : providerClients) {
            clients.putIfAbsent(client.getProcessor(), client);
        }
        this.store = store;
        this.registry = registry;
        secrets.put(ProcessorName.STRIPE, stripeSecret);
        secrets.put(ProcessorName.ADYEN, adyenHmacKey);
        for (Map.Entry<ProcessorName, String> entry : secrets.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                log.warn("No webhook secret configured for {}; its webhooks will be rejected", entry.getKey());
            }
        }
    }

    /**
     * @throws InvalidWebhookSignatureException if the signature does not verify
     * @throws IllegalArgumentException if the processor is not configured or the body is malformed
     */
    public WebhookReceipt reconcile(ProcessorName processor, String payload, String signature) {
        ProviderClient client = clients.get(processor);
        if (client == null) {
            throw new IllegalArgumentException("No provider client configured for " + processor);
        }
        String secret = secrets.get(processor);
        if (secret == null || secret.isBlank() || signature == null
                || !client.verifyWebhookSignature(payload, signature, secret)) {
            log.warn("Rejected {} webhook: signature verification failed", processor);
            throw new InvalidWebhookSignatureException(processor, "Invalid " + processor.getValue() + " webhook signature");
        }

        List<WebhookNotification> notifications = client.parseWebhook(payload);
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (WebhookNotification notification : notifications) {
            Optional<AttemptKey> key = resolve(processor, notification);
            if (key.isEmpty()) {
                continue;
            }
            pending.add(registry.ask(key.get(), actor -> actor.handleWebhook(notification)));
        }
        log.info("{} webhook: received={} dispatched={}", processor, notifications.size(), pending.size());
        return new WebhookReceipt(notifications.size(), pending.size(),
                CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])));
    }

    private Optional<AttemptKey> resolve(ProcessorName processor, WebhookNotification notification) {
        if (notification.getProviderReference() == null) {
            log.info("Ignoring {} {} webhook without a payment reference", processor, notification.getEventType());
            return Optional.empty();
        }
        Optional<AttemptKey> key = store.findByProviderReference(processor, notification.getProviderReference());
        if (key.isEmpty()) {
            log.info("Ignoring {} {} webhook for unknown reference {}",
                    processor, notification.getEventType(), notification.getProviderReference());
        }
        return key;
    }
}

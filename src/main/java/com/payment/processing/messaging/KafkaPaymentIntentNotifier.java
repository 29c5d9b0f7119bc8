package com.payment.processing.messaging;

import com.payment.processing.domain.PaymentAttempt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes attempt progress to the payment intent aggregate over Kafka.
 * Keyed by payment intent id so updates for one intent stay ordered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaPaymentIntentNotifier implements PaymentIntentNotifier {

    private final KafkaTemplate<String, PaymentIntentUpdate> kafkaTemplate;
    private final Clock clock;

    @Value("${payment.kafka.topic.payment-intent-updates:payment-intent-updates}")
    private String topic;

    @Override
    public void authorized(PaymentAttempt attempt) {
        send(toUpdate(attempt, PaymentIntentUpdate.AUTHORIZED));
    }

    @Override
    public void captured(PaymentAttempt attempt) {
        send(toUpdate(attempt, PaymentIntentUpdate.CAPTURED));
    }

    private PaymentIntentUpdate toUpdate(PaymentAttempt attempt, String eventType) {
        return PaymentIntentUpdate.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .orgId(attempt.getOrgId().toString())
                .paymentIntentId(attempt.getPaymentIntentId().toString())
                .processor(attempt.getProcessor().getValue())
                .providerReference(attempt.getProviderReference())
                .authorizationCode(attempt.getAuthorizationCode())
                .authorizedAmount(attempt.getAuthorizedAmount())
                .capturedAmount(PaymentIntentUpdate.CAPTURED.equals(eventType) ? attempt.getCapturedAmount() : null)
                .currency(attempt.getCurrency())
                .timestamp(clock.instant())
                .build();
    }

    private void send(PaymentIntentUpdate update) {
        String key = update.getPaymentIntentId();
        log.info("Publishing payment intent update: key={}, eventId={}, eventType={}, processor={}",
                key, update.getEventId(), update.getEventType(), update.getProcessor());
        CompletableFuture<SendResult<String, PaymentIntentUpdate>> future = kafkaTemplate.send(topic, key, update);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish payment intent update key={} eventId={}", key, update.getEventId(), ex);
            } else {
                log.debug("Published payment intent update key={} eventId={} partition={} offset={}",
                        key, update.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}

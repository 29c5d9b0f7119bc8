package com.payment.processing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for payment processor orchestration. Enables:
 * <ul>
 *   <li>One serialized processor actor per payment attempt (Stripe and Adyen variants)</li>
 *   <li>Per-attempt idempotency keys, per-org circuit breaking, timeouts and retries (Resilience4j)</li>
 *   <li>Webhook reconciliation and Kafka notifications to the payment intent aggregate</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class PaymentProcessingApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentProcessingApplication.class, args);
    }
}

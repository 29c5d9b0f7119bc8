package com.payment.processing.compliance;

import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.AuthorizationRequest;
import com.payment.processing.domain.ProcessorResult;
import com.payment.processing.domain.WebhookEventKind;
import com.payment.processing.domain.WebhookNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Logs every money-moving request and its outcome for audit. Payment method
 * tokens and connected accounts are masked; amounts are in minor units.
 */
@Slf4j
@Component
public class ProcessorAuditLogger {

    public void logAuthorization(AttemptKey key, String operation, AuthorizationRequest request, String idempotencyKey) {
        log.info("[AUDIT] PROCESSOR_{} attempt={} amount={} currency={} paymentMethod={} captureAutomatically={} idempotencyKey={}",
                operation.toUpperCase(Locale.ROOT),
                key,
                request.getAmount(),
                request.getCurrency(),
                CardDataMasker.maskPaymentMethodToken(request.getPaymentMethodToken()),
                request.isCaptureAutomatically(),
                CardDataMasker.shortenKey(idempotencyKey));
    }

    public void logOperation(AttemptKey key, String operation, String transactionId, Long amount, String idempotencyKey) {
        log.info("[AUDIT] PROCESSOR_{} attempt={} transactionId={} amount={} idempotencyKey={}",
                operation.toUpperCase(Locale.ROOT), key, transactionId, amount, CardDataMasker.shortenKey(idempotencyKey));
    }

    public void logResult(AttemptKey key, String operation, ProcessorResult result) {
        log.info("[AUDIT] PROCESSOR_RESULT attempt={} operation={} success={} status={} transactionId={} errorCode={}",
                key,
                operation,
                result.isSuccess(),
                result.getStatus() != null ? result.getStatus().getValue() : null,
                result.getTransactionId(),
                result.getErrorCode());
    }

    public void logWebhook(AttemptKey key, WebhookNotification notification, WebhookEventKind kind, boolean applied) {
        log.info("[AUDIT] PROCESSOR_WEBHOOK attempt={} eventType={} kind={} providerReference={} applied={}",
                key, notification.getEventType(), kind, notification.getProviderReference(), applied);
    }
}

package com.payment.processing.core.actor;

import com.payment.processing.core.IdempotencyKeyRegistry;
import com.payment.processing.core.ProviderClient;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.AttemptStatus;
import com.payment.processing.domain.AuthorizationRequest;
import com.payment.processing.domain.ErrorCodes;
import com.payment.processing.domain.PaymentAttempt;
import com.payment.processing.domain.ProcessorPaymentState;
import com.payment.processing.domain.ProcessorResult;
import com.payment.processing.domain.WebhookEventKind;
import com.payment.processing.domain.WebhookNotification;
import com.payment.processing.domain.provider.ProviderPaymentRequest;
import com.payment.processing.domain.provider.ProviderPaymentStatus;
import com.payment.processing.domain.provider.ProviderResult;
import com.payment.processing.messaging.PaymentIntentNotifier;
import com.payment.processing.persistence.ConcurrentAttemptModificationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns one payment attempt at one processor and is the only writer of its state.
 * Every operation goes through the actor's mailbox, so operations on the same
 * attempt run one at a time in arrival order while different attempts proceed
 * in parallel.
 * <p>
 * Flow of a mutating call: precondition checks, circuit check, idempotency key,
 * provider call (timeout + physical retries with the same key), normalized
 * result, state transition, durable commit, best-effort notification, result.
 * Declines, network failures and an open circuit come back as
 * {@link ProcessorResult}s; only caller misuse throws.
 */
@Slf4j
public abstract class ProcessorActor {

    protected static final String AUTHORIZE = "authorize";

    protected final AttemptKey key;
    protected final ProviderClient client;
    private final ProcessorActorContext context;
    private final AttemptMailbox mailbox;

    // Confined to the mailbox thread of the moment.
    private PaymentAttempt attempt;
    private boolean loaded;

    protected ProcessorActor(AttemptKey key, ProviderClient client, ProcessorActorContext context) {
        if (client.getProcessor() != key.getProcessor()) {
            throw new IllegalArgumentException("Client for " + client.getProcessor() + " cannot serve attempt " + key);
        }
        this.key = key;
        this.client = client;
        this.context = context;
        this.mailbox = new AttemptMailbox(key.asString(), context.getMailboxExecutor(), context.getClock());
    }

    public AttemptKey getKey() {
        return key;
    }

    public ProcessorResult authorize(AuthorizationRequest request) {
        return askForResult(AUTHORIZE, () -> runAuthorization(AUTHORIZE, request, target -> { }, client::createPayment));
    }

    /**
     * @param amount null captures the full authorized amount
     */
    public ProcessorResult capture(String transactionId, Long amount) {
        return askForResult("capture", () -> doCapture(transactionId, amount));
    }

    public ProcessorResult refund(String transactionId, long amount, String reason) {
        return askForResult("refund", () -> doRefund(transactionId, amount, reason));
    }

    public ProcessorResult voidPayment(String transactionId, String reason) {
        return askForResult("void", () -> doVoid(transactionId, reason));
    }

    /**
     * Queue a webhook for this attempt. The returned future completes once the
     * notification has been applied and committed; callers need not wait for it.
     */
    public CompletableFuture<Void> handleWebhook(WebhookNotification notification) {
        return mailbox.submit(() -> {
            try {
                applyWebhook(notification);
            } catch (ConcurrentAttemptModificationException e) {
                log.warn("Webhook {} for attempt {} lost a concurrent write; state reloaded", notification.getEventType(), key);
                throw e;
            }
            return null;
        });
    }

    public ProcessorPaymentState getState() {
        return mailbox.ask(() -> ProcessorPaymentState.of(requireAttempt()));
    }

    boolean retireIfIdle(Instant cutoff) {
        return mailbox.retireIfIdle(cutoff);
    }

    // ---------------------------------------------------------------- authorize

    @FunctionalInterface
    protected interface AuthorizationCall {
        ProviderResult invoke(ProviderPaymentRequest request, String idempotencyKey, Duration timeout);
    }

    /** Runs inside the mailbox. Variants customize the attempt and the provider call. */
    protected final ProcessorResult runAuthorization(String operation,
                                                     AuthorizationRequest request,
                                                     Consumer<PaymentAttempt> customize,
                                                     AuthorizationCall call) {
        if (request.getAmount() <= 0) {
            return ProcessorResult.failure(ErrorCodes.INVALID_AMOUNT, "Amount must be positive");
        }
        if (request.getCurrency() == null || request.getCurrency().isBlank()) {
            return ProcessorResult.failure(ErrorCodes.INVALID_AMOUNT, "Currency is required");
        }

        Instant now = now();
        PaymentAttempt existing = current();
        if (existing != null) {
            if (existing.getStatus() != AttemptStatus.FAILED || existing.getNextRetryAt() == null) {
                return ProcessorResult.failure(existing.getStatus(), ErrorCodes.INVALID_STATE,
                        "Cannot authorize payment in " + statusName(existing) + " state");
            }
            if (now.isBefore(existing.getNextRetryAt())) {
                return ProcessorResult.builder()
                        .success(false)
                        .status(existing.getStatus())
                        .errorCode(ErrorCodes.RETRY_NOT_DUE)
                        .errorMessage("Next retry allowed at " + existing.getNextRetryAt())
                        .nextRetryAt(existing.getNextRetryAt())
                        .build();
            }
        }

        if (isCircuitOpen()) {
            if (existing != null) {
                existing.appendEvent(now, operation + "_circuit_open", null, null);
                commit(existing);
            }
            return circuitOpenResult(existing);
        }

        PaymentAttempt target;
        if (existing == null) {
            target = PaymentAttempt.initialize(key, request, now);
            target.setMerchantReference(merchantReference());
        } else {
            target = existing;
            // amount, currency and capture mode stay those of the first request
            if (request.getPaymentMethodToken() != null) {
                target.setPaymentMethodToken(request.getPaymentMethodToken());
            }
        }
        customize.accept(target);
        target.setLastAttemptAt(now);

        String idempotencyKey = keys(target).getOrCreate(operation, target.getRetryCount());
        context.getAuditLogger().logAuthorization(key, operation, request, idempotencyKey);
        ProviderPaymentRequest providerRequest = toProviderRequest(target);

        ProviderResult result;
        try {
            result = callProvider(operation, () -> call.invoke(providerRequest, idempotencyKey, timeout()));
        } catch (RuntimeException e) {
            log.warn("Authorization call failed for attempt {} (retryCount={}): {}", key, target.getRetryCount(), e.getMessage());
            return failAuthorizationTransiently(target, operation, ErrorCodes.PROCESSING_ERROR, e.getMessage());
        }
        return applyAuthorizationResult(target, operation, result);
    }

    private ProcessorResult applyAuthorizationResult(PaymentAttempt target, String operation, ProviderResult result) {
        if (!result.isSuccess() || result.getStatus() == null
                || result.getStatus() == ProviderPaymentStatus.DECLINED
                || result.getStatus() == ProviderPaymentStatus.CANCELED) {
            return rejectAuthorization(target, operation, result);
        }

        Instant now = now();
        String reference = result.getReference();
        target.setProviderReference(reference);
        target.setNextRetryAt(null);
        target.clearError();

        switch (result.getStatus()) {
            case REQUIRES_ACTION:
                recordCircuitSuccess();
                target.setStatus(AttemptStatus.REQUIRES_ACTION);
                target.setNextAction(result.getNextAction());
                target.appendEvent(now, "action_required", reference,
                        result.getNextAction() != null ? result.getNextAction().getType() : null);
                commit(target);
                return ProcessorResult.builder()
                        .success(false)
                        .status(AttemptStatus.REQUIRES_ACTION)
                        .transactionId(reference)
                        .nextAction(result.getNextAction())
                        .build();
            case PENDING:
                recordCircuitSuccess();
                target.setStatus(AttemptStatus.PENDING);
                target.appendEvent(now, "authorization_pending", reference, null);
                commit(target);
                return ProcessorResult.builder()
                        .success(false)
                        .status(AttemptStatus.PENDING)
                        .transactionId(reference)
                        .errorCode(ErrorCodes.PENDING)
                        .errorMessage("Awaiting confirmation from " + key.getProcessor())
                        .build();
            case AUTHORIZED:
            case CAPTURED:
                recordCircuitSuccess();
                long amount = result.getAmount() > 0 ? result.getAmount() : target.getRequestedAmount();
                target.setAuthorizedAmount(amount);
                target.setAuthorizationCode(result.getAuthorizationCode());
                target.setAuthorizedAt(now);
                target.setNextAction(null);
                boolean captured = result.getStatus() == ProviderPaymentStatus.CAPTURED;
                if (captured) {
                    target.setCapturedAmount(amount);
                    target.setCapturedAt(now);
                    target.setStatus(AttemptStatus.CAPTURED);
                    target.appendEvent(now, "captured", reference, String.valueOf(amount));
                } else {
                    target.setStatus(AttemptStatus.AUTHORIZED);
                    target.appendEvent(now, "authorized", reference, String.valueOf(amount));
                }
                commit(target);
                if (captured) {
                    notifyIntent(notifier -> notifier.captured(target), "capture");
                } else {
                    notifyIntent(notifier -> notifier.authorized(target), "authorization");
                }
                return ProcessorResult.builder()
                        .success(true)
                        .status(target.getStatus())
                        .transactionId(reference)
                        .authorizationCode(result.getAuthorizationCode())
                        .networkTransactionId(result.getNetworkTransactionId())
                        .amount(amount)
                        .build();
            default:
                log.error("Provider returned status {} for an authorization of attempt {}", result.getStatus(), key);
                return failAuthorizationTransiently(target, operation, ErrorCodes.PROCESSING_ERROR,
                        "Unexpected provider status " + result.getStatus());
        }
    }

    private ProcessorResult rejectAuthorization(PaymentAttempt target, String operation, ProviderResult result) {
        String code = result.getErrorCode() != null ? result.getErrorCode() : "declined";
        if (context.getRetryPolicy().isRetryableError(code)) {
            return failAuthorizationTransiently(target, operation, code, result.getErrorMessage());
        }
        recordCircuitSuccess();
        if (result.getReference() != null) {
            target.setProviderReference(result.getReference());
        }
        target.setStatus(AttemptStatus.FAILED);
        target.setNextRetryAt(null);
        target.setNextAction(null);
        target.recordError(code, result.getErrorMessage());
        target.appendEvent(now(), operation + "_declined", result.getReference(), code);
        commit(target);
        return ProcessorResult.builder()
                .success(false)
                .status(AttemptStatus.FAILED)
                .transactionId(result.getReference())
                .errorCode(code)
                .errorMessage(result.getErrorMessage())
                .build();
    }

    private ProcessorResult failAuthorizationTransiently(PaymentAttempt target, String operation, String code, String message) {
        recordCircuitFailure();
        int retryCount = target.getRetryCount() + 1;
        target.setRetryCount(retryCount);
        target.setStatus(AttemptStatus.FAILED);
        target.setNextAction(null);
        target.recordError(code, message);
        boolean retry = context.getRetryPolicy().shouldRetry(retryCount, code);
        target.setNextRetryAt(retry ? context.getRetryPolicy().getNextRetryTime(retryCount) : null);
        target.appendEvent(now(), operation + "_error", null, code);
        commit(target);
        if (!retry) {
            log.warn("Attempt {} failed permanently after {} tries: {}", key, retryCount, code);
        }
        return ProcessorResult.builder()
                .success(false)
                .status(AttemptStatus.FAILED)
                .errorCode(code)
                .errorMessage(message)
                .nextRetryAt(target.getNextRetryAt())
                .build();
    }

    // ---------------------------------------------------------------- capture / refund / void

    private ProcessorResult doCapture(String transactionId, Long requestedAmount) {
        PaymentAttempt target = requireAttempt();
        if (!Objects.equals(target.getProviderReference(), transactionId)) {
            return invalidTransaction(target, transactionId);
        }
        if (target.getStatus() != AttemptStatus.AUTHORIZED) {
            return ProcessorResult.failure(target.getStatus(), ErrorCodes.INVALID_STATE,
                    "Cannot capture payment in " + statusName(target) + " state");
        }
        long amount = requestedAmount != null ? requestedAmount : target.getAuthorizedAmount();
        if (amount <= 0) {
            return ProcessorResult.failure(target.getStatus(), ErrorCodes.INVALID_AMOUNT, "Capture amount must be positive");
        }
        if (amount > target.getAuthorizedAmount()) {
            return ProcessorResult.failure(target.getStatus(), ErrorCodes.AMOUNT_TOO_LARGE,
                    "Capture amount " + amount + " exceeds authorized amount " + target.getAuthorizedAmount());
        }
        if (isCircuitOpen()) {
            return circuitOpenResult(target);
        }

        String idempotencyKey = keys(target).getOrCreate("capture_" + amount, target.getRetryCount());
        context.getAuditLogger().logOperation(key, "capture", transactionId, amount, idempotencyKey);
        ProviderResult result;
        try {
            result = callProvider("capture",
                    () -> client.capture(transactionId, amount, target.getCurrency(), idempotencyKey, timeout()));
        } catch (RuntimeException e) {
            return failOperation(target, "capture", ErrorCodes.PROCESSING_ERROR, e.getMessage(), true);
        }
        if (!result.isSuccess()) {
            return rejectOperation(target, "capture", result);
        }

        recordCircuitSuccess();
        Instant now = now();
        target.setCapturedAmount(amount);
        target.setCapturedAt(now);
        target.setStatus(AttemptStatus.CAPTURED);
        target.clearError();
        target.appendEvent(now, "captured", transactionId, String.valueOf(amount));
        commit(target);
        notifyIntent(notifier -> notifier.captured(target), "capture");
        return succeeded(target, transactionId, amount);
    }

    private ProcessorResult doRefund(String transactionId, long amount, String reason) {
        PaymentAttempt target = requireAttempt();
        if (!Objects.equals(target.getProviderReference(), transactionId)) {
            return invalidTransaction(target, transactionId);
        }
        if (target.getStatus() != AttemptStatus.CAPTURED) {
            return ProcessorResult.failure(target.getStatus(), ErrorCodes.INVALID_STATE,
                    "Cannot refund payment in " + statusName(target) + " state");
        }
        if (amount <= 0) {
            return ProcessorResult.failure(target.getStatus(), ErrorCodes.INVALID_AMOUNT, "Refund amount must be positive");
        }
        if (amount > target.refundableAmount()) {
            return ProcessorResult.failure(target.getStatus(), ErrorCodes.AMOUNT_TOO_LARGE,
                    "Refund amount " + amount + " exceeds refundable amount " + target.refundableAmount());
        }
        if (isCircuitOpen()) {
            return circuitOpenResult(target);
        }

        String idempotencyKey = keys(target).getOrCreate("refund_" + amount, target.getRefundCount());
        context.getAuditLogger().logOperation(key, "refund", transactionId, amount, idempotencyKey);
        ProviderResult result;
        try {
            result = callProvider("refund",
                    () -> client.refund(transactionId, amount, target.getCurrency(), reason, idempotencyKey, timeout()));
        } catch (RuntimeException e) {
            return failOperation(target, "refund", ErrorCodes.PROCESSING_ERROR, e.getMessage(), true);
        }
        if (!result.isSuccess()) {
            return rejectOperation(target, "refund", result);
        }

        recordCircuitSuccess();
        target.setRefundedAmount(target.getRefundedAmount() + amount);
        target.setRefundCount(target.getRefundCount() + 1);
        if (target.refundableAmount() == 0) {
            target.setStatus(AttemptStatus.REFUNDED);
        }
        target.clearError();
        target.appendEvent(now(), "refunded", result.getReference(), reason != null ? amount + ":" + reason : String.valueOf(amount));
        commit(target);
        return succeeded(target, result.getReference(), amount);
    }

    private ProcessorResult doVoid(String transactionId, String reason) {
        PaymentAttempt target = requireAttempt();
        if (!Objects.equals(target.getProviderReference(), transactionId)) {
            return invalidTransaction(target, transactionId);
        }
        if (target.getStatus() != AttemptStatus.AUTHORIZED) {
            return ProcessorResult.failure(target.getStatus(), ErrorCodes.INVALID_STATE,
                    "Cannot void payment in " + statusName(target) + " state");
        }
        if (isCircuitOpen()) {
            return circuitOpenResult(target);
        }

        String idempotencyKey = keys(target).getOrCreate("void", target.getRetryCount());
        context.getAuditLogger().logOperation(key, "void", transactionId, null, idempotencyKey);
        ProviderResult result;
        try {
            result = callProvider("void", () -> client.cancel(transactionId, reason, idempotencyKey, timeout()));
        } catch (RuntimeException e) {
            return failOperation(target, "void", ErrorCodes.PROCESSING_ERROR, e.getMessage(), true);
        }
        if (!result.isSuccess()) {
            return rejectOperation(target, "void", result);
        }

        recordCircuitSuccess();
        Instant now = now();
        target.setStatus(AttemptStatus.VOIDED);
        target.setAuthorizedAmount(0);
        target.setCanceledAt(now);
        target.clearError();
        target.appendEvent(now, "voided", transactionId, reason);
        commit(target);
        return succeeded(target, transactionId, null);
    }

    private ProcessorResult rejectOperation(PaymentAttempt target, String operation, ProviderResult result) {
        String code = result.getErrorCode() != null ? result.getErrorCode() : "declined";
        boolean transientFailure = context.getRetryPolicy().isRetryableError(code);
        return failOperation(target, operation, code, result.getErrorMessage(), transientFailure);
    }

    /** Capture/refund/void failures leave status and retry bookkeeping untouched. */
    private ProcessorResult failOperation(PaymentAttempt target, String operation, String code, String message,
                                          boolean transientFailure) {
        if (transientFailure) {
            recordCircuitFailure();
        } else {
            recordCircuitSuccess();
        }
        target.recordError(code, message);
        target.appendEvent(now(), operation + (transientFailure ? "_error" : "_failed"), target.getProviderReference(), code);
        commit(target);
        return ProcessorResult.builder()
                .success(false)
                .status(target.getStatus())
                .transactionId(target.getProviderReference())
                .errorCode(code)
                .errorMessage(message)
                .build();
    }

    // ---------------------------------------------------------------- webhooks

    private void applyWebhook(WebhookNotification notification) {
        PaymentAttempt target = requireAttempt();
        WebhookEventKind kind = client.classifyWebhookEvent(notification.getEventType(), notification.getRawPayload());
        Instant now = now();
        target.appendEvent(now, notification.getEventType(), notification.getProviderReference(), notification.getRawPayload());
        if (target.getProviderReference() == null && notification.getProviderReference() != null) {
            target.setProviderReference(notification.getProviderReference());
        }

        boolean applied = transition(target, kind, notification, now);
        commit(target);
        context.getAuditLogger().logWebhook(key, notification, kind, applied);

        if (applied && target.getStatus() == AttemptStatus.CAPTURED) {
            notifyIntent(notifier -> notifier.captured(target), "capture");
        } else if (applied && target.getStatus() == AttemptStatus.AUTHORIZED) {
            notifyIntent(notifier -> notifier.authorized(target), "authorization");
        }
    }

    private boolean transition(PaymentAttempt target, WebhookEventKind kind, WebhookNotification notification, Instant now) {
        AttemptStatus status = target.getStatus();
        switch (kind) {
            case AUTHORIZATION_SUCCEEDED:
                if (status == null || !status.isAwaitingCompletion()) {
                    return false;
                }
                target.setAuthorizedAmount(target.getRequestedAmount());
                target.setAuthorizedAt(now);
                target.setNextAction(null);
                target.clearError();
                if (target.isCaptureAutomatically()) {
                    target.setCapturedAmount(target.getAuthorizedAmount());
                    target.setCapturedAt(now);
                    target.setStatus(AttemptStatus.CAPTURED);
                } else {
                    target.setStatus(AttemptStatus.AUTHORIZED);
                }
                return true;
            case AUTHORIZATION_FAILED:
                if (status == null || !status.isAwaitingCompletion()) {
                    return false;
                }
                target.setStatus(AttemptStatus.FAILED);
                target.setNextRetryAt(null);
                target.setNextAction(null);
                target.recordError("authorization_failed", "Authorization failed: " + notification.getEventType());
                return true;
            case CAPTURED:
                if (status != AttemptStatus.AUTHORIZED) {
                    return false;
                }
                target.setCapturedAmount(target.getAuthorizedAmount());
                target.setCapturedAt(now);
                target.setStatus(AttemptStatus.CAPTURED);
                return true;
            case CANCELED:
                if (status != AttemptStatus.AUTHORIZED && (status == null || !status.isAwaitingCompletion())) {
                    return false;
                }
                target.setStatus(AttemptStatus.VOIDED);
                target.setAuthorizedAmount(0);
                target.setCanceledAt(now);
                target.setNextAction(null);
                return true;
            case CHARGEBACK:
                if (status != AttemptStatus.CAPTURED) {
                    return false;
                }
                target.setStatus(AttemptStatus.DISPUTED);
                return true;
            case REFUNDED:
            case UNKNOWN:
            default:
                return false;
        }
    }

    // ---------------------------------------------------------------- plumbing for variants

    /**
     * Run {@code work} in the mailbox and audit its result. A lost version race
     * becomes a {@code concurrent_modification} result after reloading state.
     */
    protected final ProcessorResult askForResult(String operation, Supplier<ProcessorResult> work) {
        return mailbox.ask(() -> {
            ProcessorResult result;
            try {
                result = work.get();
            } catch (ConcurrentAttemptModificationException e) {
                log.warn("Attempt {} changed under {}: {}", key, operation, e.getMessage());
                PaymentAttempt reloaded = current();
                result = ProcessorResult.failure(reloaded != null ? reloaded.getStatus() : null,
                        ErrorCodes.CONCURRENT_MODIFICATION, e.getMessage());
            }
            context.getAuditLogger().logResult(key, operation, result);
            return result;
        });
    }

    protected final <T> T ask(Supplier<T> work) {
        return mailbox.ask(work::get);
    }

    /** Loaded attempt, or null if this payment has not been authorized here yet. */
    protected final PaymentAttempt current() {
        if (!loaded) {
            attempt = context.getStore().load(key).orElse(null);
            loaded = true;
        }
        return attempt;
    }

    protected final PaymentAttempt requireAttempt() {
        PaymentAttempt current = current();
        if (current == null) {
            throw new AttemptNotFoundException(key);
        }
        return current;
    }

    /** Bump the version and persist. On any failure the cached state is dropped and reloaded lazily. */
    protected final void commit(PaymentAttempt target) {
        target.checkInvariants();
        long expectedVersion = target.getVersion();
        target.setVersion(expectedVersion + 1);
        try {
            context.getStore().save(key, target, expectedVersion);
        } catch (ConcurrentAttemptModificationException e) {
            attempt = null;
            loaded = false;
            carryIdempotencyKeys(target, e);
            throw e;
        } catch (RuntimeException e) {
            attempt = null;
            loaded = false;
            throw e;
        }
        attempt = target;
        loaded = true;
    }

    /**
     * A key minted for an (operation, generation) never changes, even when the
     * write that carried it lost the version race: the provider may already have
     * seen it. Merge such keys into the winning state and persist them.
     */
    private void carryIdempotencyKeys(PaymentAttempt stale, ConcurrentAttemptModificationException lost) {
        PaymentAttempt winner;
        try {
            winner = current();
        } catch (RuntimeException e) {
            lost.addSuppressed(e);
            return;
        }
        if (winner == null) {
            return;
        }
        Map<String, String> minted = new HashMap<>();
        for (Map.Entry<String, String> entry : stale.getIdempotencyKeys().entrySet()) {
            if (!winner.getIdempotencyKeys().containsKey(entry.getKey())) {
                minted.put(entry.getKey(), entry.getValue());
            }
        }
        if (minted.isEmpty()) {
            return;
        }
        winner.getIdempotencyKeys().putAll(minted);
        long expectedVersion = winner.getVersion();
        winner.setVersion(expectedVersion + 1);
        try {
            context.getStore().save(key, winner, expectedVersion);
            log.info("Attempt {} kept idempotency keys {} after a lost write", key, minted.keySet());
        } catch (RuntimeException e) {
            attempt = null;
            loaded = false;
            log.error("Attempt {} could not keep idempotency keys {} after a lost write", key, minted.keySet(), e);
            lost.addSuppressed(e);
        }
    }

    protected final IdempotencyKeyRegistry keys(PaymentAttempt target) {
        return IdempotencyKeyRegistry.of(target);
    }

    protected final <T> T callProvider(String operation, Supplier<T> call) {
        return context.getCallExecutor().execute(key.getProcessor().getValue() + ":" + operation, call);
    }

    protected final boolean isCircuitOpen() {
        boolean open = context.getCircuitBreaker().isOpen(key.circuitKey());
        if (open) {
            log.warn("Circuit open for {}; rejecting call for attempt {}", key.circuitKey(), key);
        }
        return open;
    }

    protected final void recordCircuitSuccess() {
        context.getCircuitBreaker().recordSuccess(key.circuitKey());
    }

    protected final void recordCircuitFailure() {
        context.getCircuitBreaker().recordFailure(key.circuitKey());
    }

    protected final Duration timeout() {
        return context.getCallExecutor().getTimeout();
    }

    protected final Instant now() {
        return context.getClock().instant();
    }

    /** Reference sent to the network with the authorization. */
    protected String merchantReference() {
        return key.getPaymentIntentId().toString();
    }

    protected ProviderPaymentRequest toProviderRequest(PaymentAttempt target) {
        return ProviderPaymentRequest.builder()
                .amount(target.getRequestedAmount())
                .currency(target.getCurrency())
                .paymentMethodToken(target.getPaymentMethodToken())
                .captureAutomatically(target.isCaptureAutomatically())
                .reference(target.getMerchantReference())
                .statementDescriptor(target.getStatementDescriptor())
                .connectedAccountId(target.getConnectedAccountId())
                .applicationFee(target.getApplicationFee())
                .metadata(target.getMetadata())
                .build();
    }

    private void notifyIntent(Consumer<PaymentIntentNotifier> notification, String what) {
        try {
            notification.accept(context.getNotifier());
        } catch (RuntimeException e) {
            log.warn("Failed to notify payment intent {} of {} at {}: {}",
                    key.getPaymentIntentId(), what, key.getProcessor(), e.getMessage(), e);
        }
    }

    private ProcessorResult circuitOpenResult(PaymentAttempt target) {
        return ProcessorResult.failure(target != null ? target.getStatus() : null, ErrorCodes.CIRCUIT_OPEN,
                "Payment processor temporarily unavailable. Please try again later.");
    }

    private ProcessorResult invalidTransaction(PaymentAttempt target, String transactionId) {
        return ProcessorResult.failure(target.getStatus(), ErrorCodes.INVALID_TRANSACTION,
                "Transaction " + transactionId + " does not belong to this payment");
    }

    private ProcessorResult succeeded(PaymentAttempt target, String transactionId, Long amount) {
        return ProcessorResult.builder()
                .success(true)
                .status(target.getStatus())
                .transactionId(transactionId)
                .authorizationCode(target.getAuthorizationCode())
                .amount(amount)
                .build();
    }

    private static String statusName(PaymentAttempt target) {
        return target.getStatus() != null ? target.getStatus().getValue() : "uninitialized";
    }
}

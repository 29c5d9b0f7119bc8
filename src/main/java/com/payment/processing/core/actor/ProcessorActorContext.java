package com.payment.processing.core.actor;

import com.payment.processing.compliance.ProcessorAuditLogger;
import com.payment.processing.core.resilience.ProcessorCircuitBreaker;
import com.payment.processing.core.resilience.ProcessorRetryPolicy;
import com.payment.processing.core.resilience.ProviderCallExecutor;
import com.payment.processing.messaging.PaymentIntentNotifier;
import com.payment.processing.persistence.service.AttemptStore;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Collaborators every processor actor shares. Actors are created per attempt,
 * not by Spring, so they receive these through this one bean.
 */
@Getter
@Component
public class ProcessorActorContext {

    private final AttemptStore store;
    private final ProcessorCircuitBreaker circuitBreaker;
    private final ProcessorRetryPolicy retryPolicy;
    private final ProviderCallExecutor callExecutor;
    private final PaymentIntentNotifier notifier;
    private final ProcessorAuditLogger auditLogger;
    private final Clock clock;
    private final ExecutorService mailboxExecutor;

    public ProcessorActorContext(AttemptStore store,
                                 ProcessorCircuitBreaker circuitBreaker,
                                 ProcessorRetryPolicy retryPolicy,
                                 ProviderCallExecutor callExecutor,
                                 PaymentIntentNotifier notifier,
                                 ProcessorAuditLogger auditLogger,
                                 Clock clock,
                                 @Qualifier("actorMailboxExecutor") ExecutorService mailboxExecutor) {
        this.store = store;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.callExecutor = callExecutor;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.mailboxExecutor = mailboxExecutor;
    }
}

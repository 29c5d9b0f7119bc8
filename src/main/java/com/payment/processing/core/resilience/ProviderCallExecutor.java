package com.payment.processing.core.resilience;

import com.payment.processing.core.ProviderCallException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one provider call under a timeout, with a small number of immediate
 * physical retries on network failure. The supplier is invoked again as-is,
 * so every physical attempt carries the same idempotency key.
 * <p>
 * Only {@link ProviderCallException} is retried; anything else propagates on the first throw.
 */
@Slf4j
@Component
public class ProviderCallExecutor {

    private final ExecutorService providerCallExecutor;
    private final Duration timeout;
    private final TimeLimiter timeLimiter;
    private final RetryRegistry retryRegistry;

    public ProviderCallExecutor(
            @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
            @Value("${payment.processing.provider.timeout:PT10S}") Duration timeout,
            @Value("${payment.processing.provider.max-attempts:2}") int maxAttempts,
            @Value("${payment.processing.provider.retry-wait:PT0.2S}") Duration retryWait) {
        this.providerCallExecutor = providerCallExecutor;
        this.timeout = timeout;
        this.timeLimiter = TimeLimiter.of("provider-call", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        this.retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(Math.max(maxAttempts, 1))
                .waitDuration(retryWait)
                .retryExceptions(ProviderCallException.class)
                .build());
    }

    /**
     * @param name     retry instance name, e.g. {@code "stripe:authorize"}
     * @param call     the provider call; must be safe to repeat (same idempotency key)
     * @throws ProviderCallException on timeout or network failure after the last attempt
     */
    public <T> T execute(String name, Supplier<T> call) {
        Retry retry = retryRegistry.retry(name);
        try {
            return Retry.decorateCheckedSupplier(retry, () -> callWithTimeout(name, call)).get();
        } catch (RuntimeException e) {
            throw e;
        } catch (Throwable e) {
            throw new ProviderCallException(name + " failed: " + e.getMessage(), e);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    private <T> T callWithTimeout(String name, Supplier<T> call) throws Exception {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, providerCallExecutor));
        } catch (TimeoutException e) {
            log.warn("Provider call {} timed out after {}ms", name, timeout.toMillis());
            throw new ProviderCallException(name + " timed out after " + timeout.toMillis() + "ms", e);
        }
    }
}

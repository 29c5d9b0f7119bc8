package com.payment.processing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and clock shared by the processor actors.
 * Mailboxes run on {@code actorMailboxExecutor}; the blocking network call
 * itself runs on {@code providerCallExecutor} so it can be timed out.
 */
@Configuration
public class ProcessingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "actorMailboxExecutor")
    public ExecutorService actorMailboxExecutor(
            @Value("${payment.processing.actor.mailbox-threads:16}") int threads) {
        return Executors.newFixedThreadPool(threads, namedThreads("actor-mailbox-"));
    }

    @Bean(name = "providerCallExecutor")
    public ExecutorService providerCallExecutor(
            @Value("${payment.processing.provider.call-threads:32}") int threads) {
        return Executors.newFixedThreadPool(threads, namedThreads("provider-call-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.payment.processing.core.actor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * FIFO queue that runs one actor's work one task at a time on a shared executor.
 * At most one drain loop per mailbox is scheduled at any moment, so tasks of the
 * same actor never overlap while different actors run in parallel.
 */
final class AttemptMailbox {

    private final String name;
    private final Executor executor;
    private final Clock clock;
    private final Deque<Envelope> queue = new ArrayDeque<>();
    private boolean running;
    private boolean retired;
    private Instant lastActivityAt;

    AttemptMailbox(String name, Executor executor, Clock clock) {
        this.name = name;
        this.executor = executor;
        this.clock = clock;
        this.lastActivityAt = clock.instant();
    }

    /**
     * @throws ActorRetiredException if the mailbox no longer accepts work
     */
    <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Runnable work = () -> {
            try {
                future.complete(task.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        };
        boolean schedule;
        synchronized (this) {
            if (retired) {
                throw new ActorRetiredException(name);
            }
            queue.addLast(new Envelope(work, future::completeExceptionally));
            lastActivityAt = clock.instant();
            schedule = !running;
            running = true;
        }
        if (schedule) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                List<Envelope> dropped;
                synchronized (this) {
                    dropped = new ArrayList<>(queue);
                    queue.clear();
                    running = false;
                }
                // includes tasks other callers queued behind this one
                dropped.forEach(envelope -> envelope.reject.accept(e));
            }
        }
        return future;
    }

    /** Submit and wait. Runtime exceptions thrown by the task are rethrown as-is. */
    <T> T ask(Callable<T> task) {
        try {
            return submit(task).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Actor " + name + " task failed", cause);
        }
    }

    synchronized boolean retireIfIdle(Instant cutoff) {
        if (running || !queue.isEmpty() || lastActivityAt.isAfter(cutoff)) {
            return false;
        }
        retired = true;
        return true;
    }

    private void drain() {
        while (true) {
            Envelope next;
            synchronized (this) {
                next = queue.pollFirst();
                if (next == null) {
                    running = false;
                    lastActivityAt = clock.instant();
                    return;
                }
            }
            next.work.run();
        }
    }

    private static final class Envelope {
        private final Runnable work;
        private final Consumer<Throwable> reject;

        private Envelope(Runnable work, Consumer<Throwable> reject) {
            this.work = work;
            this.reject = reject;
        }
    }
}

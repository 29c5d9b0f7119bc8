package com.payment.processing.core.actor;

import com.payment.processing.core.ProviderClient;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.ProcessorName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Keeps at most one live actor per attempt key in this process and routes work
 * to it. Actors are activated on first use (state loaded lazily from the store)
 * and retired by a periodic sweep once idle.
 */
@Slf4j
@Component
public class ProcessorActorRegistry {

    private final Map<ProcessorName, ProviderClient> clients = new EnumMap<>(ProcessorName.class);
    private final Map<AttemptKey, ProcessorActor> actors = new ConcurrentHashMap<>();
    private final ProcessorActorContext context;
    private final Duration idleTimeout;

    public ProcessorActorRegistry(List<ProviderClient> providerClients,
                                  ProcessorActorContext context,
                                  @Value("${payment.processing.actor.idle-timeout:PT10M}") Duration idleTimeout) {
        for (ProviderClient client : providerClients) {
            ProviderClient previous = clients.putIfAbsent(client.getProcessor(), client);
            if (previous != null) {
                log.warn("Ignoring second provider client {} for {}; using {}",
                        client.getClass().getSimpleName(), client.getProcessor(), previous.getClass().getSimpleName());
            }
        }
        this.context = context;
        this.idleTimeout = idleTimeout;
        log.info("Processor actor registry ready: processors={}, idleTimeout={}", clients.keySet(), idleTimeout);
    }

    public ProcessorActor actorFor(AttemptKey key) {
        return actors.computeIfAbsent(key, this::activate);
    }

    /**
     * Apply {@code operation} to the live actor for {@code key}, re-activating
     * it if the sweep retired it in between.
     */
    public <T> T ask(AttemptKey key, Function<ProcessorActor, T> operation) {
        return ask(key, ProcessorActor.class, operation);
    }

    /**
     * As {@link #ask(AttemptKey, Function)} for a network-specific operation.
     *
     * @throws IllegalArgumentException if the key's processor has no such operation
     */
    public <A extends ProcessorActor, T> T ask(AttemptKey key, Class<A> actorType, Function<A, T> operation) {
        while (true) {
            ProcessorActor actor = actorFor(key);
            if (!actorType.isInstance(actor)) {
                throw new IllegalArgumentException("Operation not supported by processor " + key.getProcessor());
            }
            try {
                return operation.apply(actorType.cast(actor));
            } catch (ActorRetiredException e) {
                actors.remove(key, actor);
                log.debug("Actor {} was retired mid-request; re-activating", key);
            }
        }
    }

    @Scheduled(fixedDelayString = "${payment.processing.actor.sweep-interval:PT1M}")
    public int retireIdleActors() {
        Instant cutoff = context.getClock().instant().minus(idleTimeout);
        int retired = 0;
        for (Map.Entry<AttemptKey, ProcessorActor> entry : actors.entrySet()) {
            if (entry.getValue().retireIfIdle(cutoff) && actors.remove(entry.getKey(), entry.getValue())) {
                retired++;
            }
        }
        if (retired > 0) {
            log.info("Retired {} idle processor actors; {} still active", retired, actors.size());
        }
        return retired;
    }

    public int activeActorCount() {
        return actors.size();
    }

    private ProcessorActor activate(AttemptKey key) {
        ProviderClient client = clients.get(key.getProcessor());
        if (client == null) {
            throw new IllegalArgumentException("No provider client configured for " + key.getProcessor());
        }
        log.debug("Activating processor actor {}", key);
        switch (key.getProcessor()) {
            case STRIPE:
                return new StripeProcessorActor(key, client, context);
            case ADYEN:
                return new AdyenProcessorActor(key, client, context);
            default:
                throw new IllegalArgumentException("Unsupported processor " + key.getProcessor());
        }
    }
}

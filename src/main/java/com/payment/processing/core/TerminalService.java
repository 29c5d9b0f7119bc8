package com.payment.processing.core;

import com.payment.processing.core.resilience.ProcessorCircuitBreaker;
import com.payment.processing.core.resilience.ProviderCallExecutor;
import com.payment.processing.domain.ErrorCodes;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.provider.ConnectionTokenResult;
import com.payment.processing.domain.provider.TerminalPairingRequest;
import com.payment.processing.domain.provider.TerminalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Card-present terminal pairing and connection tokens. These calls do not
 * belong to a payment attempt, but share the org's circuit breaker at each processor.
 */
@Slf4j
@Service
public class TerminalService {

    private static final String CIRCUIT_OPEN_MESSAGE = "Payment processor temporarily unavailable. Please try again later.";

    private final Map<ProcessorName, ProviderClient> clients = new EnumMap<>(ProcessorName.class);
    private final ProcessorCircuitBreaker circuitBreaker;
    private final ProviderCallExecutor callExecutor;

    public TerminalService(List<ProviderClient> providerClients,
                           ProcessorCircuitBreaker circuitBreaker,
                           ProviderCallExecutor callExecutor) {
        for (ProviderClient client : providerClients) {
            clients.putIfAbsent(client.getProcessor(), client);
        }
        this.circuitBreaker = circuitBreaker;
        this.callExecutor = callExecutor;
    }

    public TerminalResult pair(UUID orgId, ProcessorName processor, TerminalPairingRequest request) {
        ProviderClient client = clientFor(processor);
        String circuitKey = circuitKey(processor, orgId);
        if (circuitBreaker.isOpen(circuitKey)) {
            return TerminalResult.failure(ErrorCodes.CIRCUIT_OPEN, CIRCUIT_OPEN_MESSAGE);
        }
        log.info("Pairing terminal {} for org {} at {} (location={})",
                request.getTerminalId(), orgId, processor, request.getLocationId() != null ? request.getLocationId() : request.getStoreId());
        try {
            TerminalResult result = guarded(circuitKey, processor.getValue() + ":pair_terminal",
                    () -> client.registerTerminal(request, callExecutor.getTimeout()));
            if (!result.isSuccess()) {
                log.warn("Terminal pairing rejected by {}: {} {}", processor, result.getErrorCode(), result.getErrorMessage());
            }
            return result;
        } catch (RuntimeException e) {
            return TerminalResult.failure(ErrorCodes.PROCESSING_ERROR, e.getMessage());
        }
    }

    public ConnectionTokenResult connectionToken(UUID orgId, ProcessorName processor, String locationId) {
        ProviderClient client = clientFor(processor);
        String circuitKey = circuitKey(processor, orgId);
        if (circuitBreaker.isOpen(circuitKey)) {
            return ConnectionTokenResult.failure(ErrorCodes.CIRCUIT_OPEN, CIRCUIT_OPEN_MESSAGE);
        }
        try {
            return guarded(circuitKey, processor.getValue() + ":connection_token",
                    () -> client.createConnectionToken(locationId, callExecutor.getTimeout()));
        } catch (RuntimeException e) {
            return ConnectionTokenResult.failure(ErrorCodes.PROCESSING_ERROR, e.getMessage());
        }
    }

    private <T> T guarded(String circuitKey, String name, Supplier<T> call) {
        T result;
        try {
            result = callExecutor.execute(name, call);
        } catch (RuntimeException e) {
            log.warn("{} failed: {}", name, e.getMessage());
            circuitBreaker.recordFailure(circuitKey);
            throw e;
        }
        circuitBreaker.recordSuccess(circuitKey);
        return result;
    }

    private ProviderClient clientFor(ProcessorName processor) {
        ProviderClient client = clients.get(processor);
        if (client == null) {
            throw new IllegalArgumentException("No provider client configured for " + processor);
        }
        return client;
    }

    private static String circuitKey(ProcessorName processor, UUID orgId) {
        return processor.getValue() + ":" + orgId;
    }
}

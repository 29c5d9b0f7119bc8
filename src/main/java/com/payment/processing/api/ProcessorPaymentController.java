package com.payment.processing.api;

import com.payment.processing.core.actor.AdyenProcessorActor;
import com.payment.processing.core.actor.ProcessorActor;
import com.payment.processing.core.actor.ProcessorActorRegistry;
import com.payment.processing.core.actor.StripeProcessorActor;
import com.payment.processing.core.idempotency.RequestIdempotencyService;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.ProcessorName;
import com.payment.processing.domain.ProcessorPaymentState;
import com.payment.processing.domain.ProcessorResult;
import com.payment.processing.domain.provider.SetupIntentResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;
import java.util.function.Function;

/**
 * REST API for payment operations at one card network. Every call is routed to
 * the actor owning {@code {orgId}:{processor}:{paymentIntentId}}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orgs/{orgId}/processors/{processor}/payments")
@RequiredArgsConstructor
@Tag(name = "Processor payments", description = "Authorize, capture, refund and void at a card network")
public class ProcessorPaymentController {

    private final ProcessorActorRegistry registry;
    private final RequestIdempotencyService idempotencyService;

    @PostMapping
    @Operation(
            summary = "Authorize payment",
            description = "Authorize (and by default capture) a payment with a network payment method token. "
                    + "Send the same paymentIntentId to retry a failed authorization once nextRetryAt has passed. "
                    + "Declines, pending payments and 3-D Secure challenges return 200 with success=false; check errorCode and nextAction.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authorization processed. Check body.success and body.status.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ProcessorPaymentResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed or unknown processor."),
            @ApiResponse(responseCode = "409", description = "Idempotency-Key already used by a request that succeeded.")
    })
    public ResponseEntity<ProcessorPaymentResponseDto> authorize(
            @PathVariable UUID orgId,
            @PathVariable String processor,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody AuthorizePaymentRequestDto dto) {
        ProcessorName processorName = ProcessorName.fromValue(processor);
        UUID paymentIntentId = dto.getPaymentIntentId() != null ? dto.getPaymentIntentId() : UUID.randomUUID();
        AttemptKey key = AttemptKey.of(orgId, processorName, paymentIntentId);

        if (idempotencyKey != null && !idempotencyService.tryAcquire(orgId, idempotencyKey, "authorize", paymentIntentId, null)) {
            throw new DuplicateRequestException(idempotencyKey);
        }
        ProcessorResult result = registry.ask(key, actor -> actor.authorize(dto.toAuthorizationRequest()));
        if (idempotencyKey != null) {
            idempotencyService.markKeyUsed(orgId, idempotencyKey, result.isSuccess(), idempotencyService.computeResultHash(result));
        }
        log.debug("Authorization completed: attempt={} success={} status={}", key, result.isSuccess(), result.getStatus());
        return ResponseEntity.ok(ProcessorPaymentResponseDto.from(paymentIntentId, processorName, result));
    }

    @PostMapping("/{paymentIntentId}/capture")
    @Operation(summary = "Capture payment", description = "Capture an authorized payment in full or in part.")
    public ResponseEntity<ProcessorPaymentResponseDto> capture(@PathVariable UUID orgId,
                                                               @PathVariable String processor,
                                                               @PathVariable UUID paymentIntentId,
                                                               @Valid @RequestBody CaptureRequestDto dto) {
        return respond(orgId, processor, paymentIntentId, actor -> actor.capture(dto.getTransactionId(), dto.getAmount()));
    }

    @PostMapping("/{paymentIntentId}/refund")
    @Operation(summary = "Refund payment", description = "Refund part or all of a captured payment. Several partial refunds are allowed.")
    public ResponseEntity<ProcessorPaymentResponseDto> refund(@PathVariable UUID orgId,
                                                              @PathVariable String processor,
                                                              @PathVariable UUID paymentIntentId,
                                                              @Valid @RequestBody RefundRequestDto dto) {
        return respond(orgId, processor, paymentIntentId,
                actor -> actor.refund(dto.getTransactionId(), dto.getAmount(), dto.getReason()));
    }

    @PostMapping("/{paymentIntentId}/void")
    @Operation(summary = "Void payment", description = "Cancel an authorization that has not been captured.")
    public ResponseEntity<ProcessorPaymentResponseDto> voidPayment(@PathVariable UUID orgId,
                                                                   @PathVariable String processor,
                                                                   @PathVariable UUID paymentIntentId,
                                                                   @Valid @RequestBody VoidRequestDto dto) {
        return respond(orgId, processor, paymentIntentId, actor -> actor.voidPayment(dto.getTransactionId(), dto.getReason()));
    }

    @GetMapping("/{paymentIntentId}")
    @Operation(summary = "Get payment state", description = "Current state and event history of the payment at this network.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment found"),
            @ApiResponse(responseCode = "404", description = "No payment with this id at this network")
    })
    public ResponseEntity<ProcessorPaymentState> getPayment(@PathVariable UUID orgId,
                                                            @PathVariable String processor,
                                                            @PathVariable UUID paymentIntentId) {
        AttemptKey key = AttemptKey.of(orgId, ProcessorName.fromValue(processor), paymentIntentId);
        return ResponseEntity.ok(registry.ask(key, ProcessorActor::getState));
    }

    @PostMapping("/{paymentIntentId}/split")
    @Operation(summary = "Authorize split payment", description = "Adyen only. Authorize with the amount divided between accounts.")
    public ResponseEntity<ProcessorPaymentResponseDto> authorizeSplit(@PathVariable UUID orgId,
                                                                      @PathVariable String processor,
                                                                      @PathVariable UUID paymentIntentId,
                                                                      @Valid @RequestBody SplitAuthorizationRequestDto dto) {
        ProcessorName processorName = ProcessorName.fromValue(processor);
        AttemptKey key = AttemptKey.of(orgId, processorName, paymentIntentId);
        ProcessorResult result = registry.ask(key, AdyenProcessorActor.class,
                actor -> actor.authorizeWithSplit(dto.toAuthorizationRequest(), dto.getSplits()));
        return ResponseEntity.ok(ProcessorPaymentResponseDto.from(paymentIntentId, processorName, result));
    }

    @PostMapping("/{paymentIntentId}/on-behalf-of")
    @Operation(summary = "Authorize on behalf of a connected account", description = "Stripe only. Destination charge with an optional application fee.")
    public ResponseEntity<ProcessorPaymentResponseDto> authorizeOnBehalfOf(@PathVariable UUID orgId,
                                                                           @PathVariable String processor,
                                                                           @PathVariable UUID paymentIntentId,
                                                                           @Valid @RequestBody OnBehalfOfRequestDto dto) {
        ProcessorName processorName = ProcessorName.fromValue(processor);
        AttemptKey key = AttemptKey.of(orgId, processorName, paymentIntentId);
        ProcessorResult result = registry.ask(key, StripeProcessorActor.class,
                actor -> actor.authorizeOnBehalfOf(dto.toAuthorizationRequest(), dto.getConnectedAccountId(), dto.getApplicationFee()));
        return ResponseEntity.ok(ProcessorPaymentResponseDto.from(paymentIntentId, processorName, result));
    }

    @PostMapping("/setup-intents")
    @Operation(summary = "Create setup intent", description = "Stripe only. Save a customer's card for later use without charging it.")
    public ResponseEntity<SetupIntentResult> createSetupIntent(@PathVariable UUID orgId,
                                                               @PathVariable String processor,
                                                               @Valid @RequestBody SetupIntentRequestDto dto) {
        AttemptKey key = AttemptKey.of(orgId, ProcessorName.fromValue(processor), dto.getPaymentIntentId());
        SetupIntentResult result = registry.ask(key, StripeProcessorActor.class,
                actor -> actor.createSetupIntent(dto.getCustomerId()));
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<ProcessorPaymentResponseDto> respond(UUID orgId, String processor, UUID paymentIntentId,
                                                                Function<ProcessorActor, ProcessorResult> operation) {
        ProcessorName processorName = ProcessorName.fromValue(processor);
        ProcessorResult result = registry.ask(AttemptKey.of(orgId, processorName, paymentIntentId), operation);
        return ResponseEntity.ok(ProcessorPaymentResponseDto.from(paymentIntentId, processorName, result));
    }
}

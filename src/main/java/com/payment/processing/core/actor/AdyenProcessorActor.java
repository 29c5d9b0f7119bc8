package com.payment.processing.core.actor;

import com.payment.processing.core.ProviderClient;
import com.payment.processing.domain.AttemptKey;
import com.payment.processing.domain.AuthorizationRequest;
import com.payment.processing.domain.ErrorCodes;
import com.payment.processing.domain.ProcessorResult;
import com.payment.processing.domain.SplitAllocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Adyen-style card network: every payment carries a merchant reference and
 * may be split across several accounts at authorization.
 */
public class AdyenProcessorActor extends ProcessorActor {

    private static final String AUTHORIZE_SPLIT = "authorize_split";

    public AdyenProcessorActor(AttemptKey key, ProviderClient client, ProcessorActorContext context) {
        super(key, client, context);
    }

    /**
     * Authorize with the amount divided between {@code splits}; their sum must
     * equal the request amount.
     */
    public ProcessorResult authorizeWithSplit(AuthorizationRequest request, List<SplitAllocation> splits) {
        if (splits == null || splits.isEmpty()) {
            return ProcessorResult.failure(ErrorCodes.INVALID_AMOUNT, "At least one split is required");
        }
        long total = 0;
        for (SplitAllocation split : splits) {
            if (split.getAmount() <= 0) {
                return ProcessorResult.failure(ErrorCodes.INVALID_AMOUNT, "Split amounts must be positive");
            }
            total += split.getAmount();
        }
        if (total != request.getAmount()) {
            return ProcessorResult.failure(ErrorCodes.INVALID_AMOUNT,
                    "Split amounts add up to " + total + " but the payment amount is " + request.getAmount());
        }
        List<SplitAllocation> allocations = List.copyOf(splits);
        return askForResult(AUTHORIZE_SPLIT, () -> runAuthorization(AUTHORIZE_SPLIT, request,
                attempt -> attempt.setSplits(new ArrayList<>(allocations)),
                (providerRequest, idempotencyKey, timeout) ->
                        client.createSplitPayment(providerRequest, allocations, idempotencyKey, timeout)));
    }

    @Override
    protected String merchantReference() {
        return "dv_" + key.getPaymentIntentId().toString().replace("-", "");
    }
}

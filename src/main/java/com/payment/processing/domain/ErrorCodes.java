package com.payment.processing.domain;

/**
 * Error codes the actors put in {@link ProcessorResult#getErrorCode()} for
 * outcomes they decide themselves. Provider declines carry the provider's own code.
 */
public final class ErrorCodes {

    public static final String CIRCUIT_OPEN = "circuit_open";
    public static final String PROCESSING_ERROR = "processing_error";
    public static final String INVALID_TRANSACTION = "invalid_transaction";
    public static final String INVALID_STATE = "invalid_state";
    public static final String INVALID_AMOUNT = "invalid_amount";
    public static final String AMOUNT_TOO_LARGE = "amount_too_large";
    public static final String RETRY_NOT_DUE = "retry_not_due";
    public static final String PENDING = "pending";
    public static final String UNSUPPORTED_OPERATION = "unsupported_operation";
    public static final String CONCURRENT_MODIFICATION = "concurrent_modification";

    private ErrorCodes() {}
}

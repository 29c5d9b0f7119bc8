package com.payment.processing.compliance;

/**
 * Redacts payment method and account identifiers so they are safe to include in logs.
 */
public final class CardDataMasker {

    private static final String MASKED = "***";

    private CardDataMasker() {}

    /**
     * Keeps the network prefix so logs still show which kind of token was used
     * ("pm_card_visa" -> "pm_***", "scheme_3ds" -> "scheme_***").
     */
    public static String maskPaymentMethodToken(String token) {
        if (token == null || token.isBlank()) return null;
        int underscore = token.indexOf('_');
        if (underscore <= 0) return MASKED;
        return token.substring(0, underscore + 1) + MASKED;
    }

    /** "acct_1N2x3yZ" -> "acct_***3yZ". */
    public static String maskAccountId(String accountId) {
        if (accountId == null || accountId.isBlank()) return null;
        if (accountId.length() <= 8) return MASKED;
        return maskPaymentMethodToken(accountId) + accountId.substring(accountId.length() - 3);
    }

    /** Idempotency keys are not secret, but the random tail is noise in logs. */
    public static String shortenKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.length() <= 16) return idempotencyKey;
        return idempotencyKey.substring(0, idempotencyKey.length() - 24) + "...";
    }
}

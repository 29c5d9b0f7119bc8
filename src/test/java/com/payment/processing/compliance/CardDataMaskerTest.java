package com.payment.processing.compliance;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CardDataMaskerTest {

    @Test
    void paymentMethodTokenKeepsOnlyPrefix() {
        assertThat(CardDataMasker.maskPaymentMethodToken("pm_card_visa")).isEqualTo("pm_***");
        assertThat(CardDataMasker.maskPaymentMethodToken("scheme_3ds")).isEqualTo("scheme_***");
        assertThat(CardDataMasker.maskPaymentMethodToken("4242424242424242")).isEqualTo("***");
        assertThat(CardDataMasker.maskPaymentMethodToken(" ")).isNull();
        assertThat(CardDataMasker.maskPaymentMethodToken(null)).isNull();
    }

    @Test
    void accountIdKeepsPrefixAndLastThree() {
        assertThat(CardDataMasker.maskAccountId("acct_1N2x3yZ")).isEqualTo("acct_***3yZ");
        assertThat(CardDataMasker.maskAccountId("acct_1")).isEqualTo("***");
    }

    @Test
    void longIdempotencyKeysAreShortened() {
        String key = "idem_authorize_0123456789abcdef0123456789abcdef";

        assertThat(CardDataMasker.shortenKey(key)).isEqualTo("idem_authorize_01234567...");
        assertThat(CardDataMasker.shortenKey("short_key")).isEqualTo("short_key");
    }
}

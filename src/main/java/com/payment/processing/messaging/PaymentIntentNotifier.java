package com.payment.processing.messaging;

import com.payment.processing.domain.PaymentAttempt;

/**
 * Tells the payment intent aggregate that an attempt moved forward.
 * Implementations may throw; actors log and swallow the failure.
 */
public interface PaymentIntentNotifier {

    void authorized(PaymentAttempt attempt);

    void captured(PaymentAttempt attempt);
}

package com.payment.command.api;

/**
 * Thrown when a payment id does not exist. Handler returns HTTP 404.
 */
public class PaymentNotFoundException extends RuntimeException {

    public PaymentNotFoundException(String paymentId) {
        super("Payment not found: " + paymentId);
    }
}

package com.payment.command.core;

/**
 * Tag of the closed set of {@link PaymentCommand} variants.
 */
public enum CommandType {
    PROCESS_PAYMENT,
    RECURRING_PAYMENT
}

package com.payment.command.core;

import com.payment.command.domain.Payment;

/**
 * One payment intent packaged as an object with a compensating action. The set of
 * commands is fixed: a one-off charge and a subscription charge.
 * <p>
 * Commands report every outcome as a {@link CommandResult}; they never throw for a
 * business failure.
 */
public sealed interface PaymentCommand permits ProcessPaymentCommand, RecurringPaymentCommand {

    CommandType getType();

    /**
     * Charge through the gateway, creating a new payment.
     */
    CommandResult execute();

    /**
     * Refund the payment produced by the most recent {@link #execute()}. Fails when there
     * is no payment or it is not COMPLETED.
     */
    CommandResult undo();

    /**
     * Whether the most recent execution completed its payment.
     */
    boolean succeeded();

    /**
     * Payment produced by the most recent execution, or null.
     */
    Payment getPayment();
}

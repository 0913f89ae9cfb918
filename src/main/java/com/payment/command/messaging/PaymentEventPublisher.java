package com.payment.command.messaging;

import com.payment.command.core.CommandResult;
import com.payment.command.core.CommandType;
import com.payment.command.domain.Payment;

/**
 * Outbound notification of payment lifecycle changes. Publishing never fails the payment
 * flow; implementations log delivery problems instead.
 */
public interface PaymentEventPublisher {

    /** Publish the outcome of an execution that produced a payment. */
    void publishExecuted(CommandType commandType, CommandResult result);

    void publishRefunded(Payment payment);
}

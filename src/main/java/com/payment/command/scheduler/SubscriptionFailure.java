package com.payment.command.scheduler;

import com.payment.command.core.CommandError;
import com.payment.command.domain.Payment;
import lombok.Value;

/**
 * A subscription whose installment did not complete during a scan. {@code payment} is set
 * when a charge was attempted (for example a declined card).
 */
@Value
public class SubscriptionFailure {

    String subscriptionId;
    CommandError error;
    Payment payment;
}

package com.payment.command.core;

import com.payment.command.domain.Payment;
import com.payment.command.domain.Subscription;
import com.payment.command.gateway.PaymentGateway;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Charges one installment of a subscription. Each execution delegates to a fresh
 * {@link ProcessPaymentCommand}, so every installment gets its own payment, and then moves
 * the subscription's due date one interval past the previous due date whether the charge
 * was approved or declined.
 */
@Slf4j
public final class RecurringPaymentCommand implements PaymentCommand {

    private final Subscription subscription;
    private final PaymentGateway gateway;
    private final Clock clock;
    /** Instant of the scan that built this command; decides whether the installment is due. */
    private final Instant asOf;

    private ProcessPaymentCommand charge;

    public RecurringPaymentCommand(Subscription subscription, PaymentGateway gateway, Clock clock, Instant asOf) {
        this.subscription = subscription;
        this.gateway = gateway;
        this.clock = clock;
        this.asOf = asOf;
    }

    @Override
    public CommandType getType() {
        return CommandType.RECURRING_PAYMENT;
    }

    @Override
    public CommandResult execute() {
        charge = null;
        if (!subscription.isActive()) {
            log.warn("Subscription subscriptionId={} is {}; skipping charge", subscription.getId(), subscription.getStatus());
            return CommandResult.failure(ErrorCode.SUBSCRIPTION_NOT_ACTIVE, String.format(
                    "Cannot process payment for subscription %s with status %s", subscription.getId(), subscription.getStatus()));
        }
        if (subscription.getNextPaymentDate().isAfter(asOf)) {
            log.info("Subscription subscriptionId={} not due until {}", subscription.getId(), subscription.getNextPaymentDate());
            return CommandResult.failure(ErrorCode.SUBSCRIPTION_NOT_DUE, String.format(
                    "Subscription %s is not due until %s", subscription.getId(), subscription.getNextPaymentDate()));
        }

        charge = new ProcessPaymentCommand(subscription.getAmount(), subscription.getCurrency(),
                subscription.getCustomerRef(), subscription.getId(), gateway, clock);
        try {
            return charge.execute();
        } finally {
            // any attempt that reached the gateway consumes the installment, even if it blew up midway
            if (charge.getPayment() != null) {
                Instant previous = subscription.getNextPaymentDate();
                subscription.advanceNextPaymentDate();
                log.info("Subscription subscriptionId={} advanced nextPaymentDate {} -> {}",
                        subscription.getId(), previous, subscription.getNextPaymentDate());
            }
        }
    }

    @Override
    public CommandResult undo() {
        if (charge == null) {
            return CommandResult.failure(ErrorCode.COMMAND_NOT_SUCCESSFUL,
                    "Cannot undo: no installment was charged for subscription " + subscription.getId());
        }
        log.info("Undoing installment of subscription subscriptionId={}", subscription.getId());
        return charge.undo();
    }

    @Override
    public boolean succeeded() {
        return charge != null && charge.succeeded();
    }

    @Override
    public Payment getPayment() {
        return charge != null ? charge.getPayment() : null;
    }

    @Override
    public String toString() {
        return "RecurringPaymentCommand(subscriptionId=" + subscription.getId()
                + ", customerRef=" + subscription.getCustomerRef() + ")";
    }
}

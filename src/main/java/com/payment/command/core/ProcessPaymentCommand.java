package com.payment.command.core;

import com.payment.command.domain.Payment;
import com.payment.command.gateway.GatewayChargeResult;
import com.payment.command.gateway.GatewayRefundResult;
import com.payment.command.gateway.PaymentGateway;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Charges a customer once. Every {@link #execute()} validates the intent, creates a new
 * PENDING payment and settles it from the gateway answer; {@link #undo()} refunds the
 * payment of the latest execution.
 */
@Slf4j
public final class ProcessPaymentCommand implements PaymentCommand {

    private final BigDecimal amount;
    private final String currency;
    private final String customerRef;
    private final String subscriptionId;
    private final PaymentGateway gateway;
    private final Clock clock;

    private Payment payment;
    private boolean succeeded;

    public ProcessPaymentCommand(BigDecimal amount, String currency, String customerRef,
                                 String subscriptionId, PaymentGateway gateway, Clock clock) {
        this.amount = amount;
        this.currency = currency;
        this.customerRef = customerRef;
        this.subscriptionId = subscriptionId;
        this.gateway = gateway;
        this.clock = clock;
    }

    public ProcessPaymentCommand(BigDecimal amount, String currency, String customerRef,
                                 PaymentGateway gateway, Clock clock) {
        this(amount, currency, customerRef, null, gateway, clock);
    }

    @Override
    public CommandType getType() {
        return CommandType.PROCESS_PAYMENT;
    }

    @Override
    public CommandResult execute() {
        succeeded = false;
        Optional<String> problem = PaymentIntentValidator.validate(amount, currency, customerRef);
        if (problem.isPresent()) {
            log.warn("Rejected payment intent amount={} currency={} customerRef={}: {}",
                    amount, currency, customerRef, problem.get());
            return CommandResult.failure(ErrorCode.INVALID_ARGUMENT, problem.get());
        }

        payment = Payment.pending(amount, currency, customerRef, subscriptionId, clock.instant());
        log.info("Processing payment paymentId={} amount={} {} customerRef={}",
                payment.getId(), amount, currency, customerRef);

        GatewayChargeResult charge = gateway.charge(amount, currency, customerRef);
        if (charge == null) {
            throw new IllegalStateException("Gateway " + gateway.getGatewayName() + " returned no charge result");
        }

        if (charge.isApproved()) {
            payment.markCompleted(charge.getTransactionReference(), clock.instant());
            succeeded = true;
            log.info("Payment paymentId={} completed transactionReference={}",
                    payment.getId(), charge.getTransactionReference());
            return CommandResult.success(payment);
        }

        payment.markFailed();
        log.warn("Payment paymentId={} declined failureCode={} message={}",
                payment.getId(), charge.getFailureCode(), charge.getMessage());
        return CommandResult.failure(payment, ErrorCode.GATEWAY_DECLINED,
                "Payment declined: " + charge.getMessage());
    }

    @Override
    public CommandResult undo() {
        if (payment == null) {
            return CommandResult.failure(ErrorCode.COMMAND_NOT_SUCCESSFUL,
                    "Cannot undo: command has not produced a payment");
        }
        if (!payment.isCompleted()) {
            return CommandResult.failure(payment, ErrorCode.COMMAND_NOT_SUCCESSFUL,
                    String.format("Cannot refund payment %s with status %s", payment.getId(), payment.getStatus()));
        }

        log.info("Refunding payment paymentId={} transactionReference={}",
                payment.getId(), payment.getTransactionReference());
        GatewayRefundResult refund = gateway.refund(payment.getTransactionReference());
        if (refund == null) {
            throw new IllegalStateException("Gateway " + gateway.getGatewayName() + " returned no refund result");
        }

        switch (refund.getStatus()) {
            case SUCCEEDED:
                payment.markRefunded();
                log.info("Payment paymentId={} refunded refundReference={}",
                        payment.getId(), refund.getRefundReference());
                return CommandResult.success(payment);
            case UNKNOWN_REFERENCE:
                log.warn("Refund of paymentId={} rejected: {}", payment.getId(), refund.getMessage());
                return CommandResult.failure(payment, ErrorCode.INVALID_REFERENCE, refund.getMessage());
            default:
                log.warn("Refund of paymentId={} failed failureCode={}", payment.getId(), refund.getFailureCode());
                return CommandResult.failure(payment, ErrorCode.REFUND_FAILED,
                        "Refund failed: " + refund.getMessage());
        }
    }

    @Override
    public boolean succeeded() {
        return succeeded;
    }

    @Override
    public Payment getPayment() {
        return payment;
    }

    @Override
    public String toString() {
        return "ProcessPaymentCommand(amount=" + amount + ", currency=" + currency
                + ", customerRef=" + customerRef + ")";
    }
}

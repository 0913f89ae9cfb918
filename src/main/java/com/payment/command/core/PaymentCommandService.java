package com.payment.command.core;

import com.payment.command.api.PaymentNotFoundException;
import com.payment.command.compliance.ComplianceAuditLogger;
import com.payment.command.domain.Payment;
import com.payment.command.domain.PaymentStatus;
import com.payment.command.messaging.PaymentEventPublisher;
import com.payment.command.persistence.service.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for one-off payments. Each payment is executed through its own
 * {@link CommandInvoker}, which stays registered in the {@link CommandSessionRegistry} so a
 * later refund request undoes exactly that command.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentCommandService {

    private final PaymentCommandFactory commandFactory;
    private final CommandSessionRegistry sessionRegistry;
    private final PaymentPersistenceService paymentPersistenceService;
    private final PaymentEventPublisher eventPublisher;
    private final ComplianceAuditLogger auditLogger;

    /**
     * Charge the customer once. Declined payments are stored and returned with a
     * {@link ErrorCode#GATEWAY_DECLINED} error; invalid input creates no payment.
     */
    public CommandResult executeProcessPayment(BigDecimal amount, String currency, String customerRef) {
        ProcessPaymentCommand command = commandFactory.processPayment(amount, currency, customerRef);
        CommandInvoker invoker = new CommandInvoker();
        CommandResult result = invoker.execute(command);
        auditLogger.logExecuted(CommandType.PROCESS_PAYMENT, customerRef, result);

        if (!result.hasPayment()) {
            return result;
        }
        Payment payment = result.getPayment();
        try {
            paymentPersistenceService.save(payment);
        } catch (RuntimeException e) {
            log.error("Failed to record payment paymentId={} status={} transactionReference={}",
                    payment.getId(), payment.getStatus(), payment.getTransactionReference(), e);
            return CommandResult.failure(payment, ErrorCode.INTERNAL,
                    "Payment " + payment.getId() + " was processed but could not be recorded");
        }
        sessionRegistry.register(payment.getId(), invoker);
        eventPublisher.publishExecuted(CommandType.PROCESS_PAYMENT, result);
        return result;
    }

    /**
     * Undo the command that produced the payment. Only payments whose command session is
     * still live can be refunded; the result always carries the payment.
     *
     * @throws PaymentNotFoundException if no such payment exists
     */
    public CommandResult executeRefund(String paymentId) {
        Payment stored = paymentPersistenceService.findById(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));

        Optional<CommandInvoker> session = sessionRegistry.find(paymentId);
        if (session.isEmpty()) {
            log.warn("No live command session for paymentId={} status={}", paymentId, stored.getStatus());
            CommandResult result = CommandResult.failure(stored, ErrorCode.NO_COMMAND_TO_UNDO,
                    "No command to undo for payment " + paymentId);
            auditLogger.logUndone(paymentId, result);
            return result;
        }

        CommandResult result = session.get().undoLast();
        if (!result.hasPayment()) {
            result = CommandResult.failure(stored, result.getErrorCode(), result.getError().getMessage());
        }
        auditLogger.logUndone(paymentId, result);
        if (!result.isSuccess()) {
            return result;
        }

        Payment refunded = result.getPayment();
        sessionRegistry.remove(paymentId);
        try {
            paymentPersistenceService.save(refunded);
        } catch (RuntimeException e) {
            log.error("Failed to record refund of paymentId={} transactionReference={}",
                    paymentId, refunded.getTransactionReference(), e);
            return CommandResult.failure(refunded, ErrorCode.INTERNAL,
                    "Payment " + paymentId + " was refunded but could not be recorded");
        }
        eventPublisher.publishRefunded(refunded);
        return result;
    }

    public Payment getPayment(String paymentId) {
        return paymentPersistenceService.findById(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));
    }

    public List<Payment> listPayments(PaymentStatus status, String customerRef) {
        return paymentPersistenceService.list(status, customerRef);
    }
}

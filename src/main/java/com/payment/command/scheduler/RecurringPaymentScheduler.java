package com.payment.command.scheduler;

import com.payment.command.api.SubscriptionNotFoundException;
import com.payment.command.compliance.ComplianceAuditLogger;
import com.payment.command.config.PaymentEngineConfig;
import com.payment.command.core.CommandError;
import com.payment.command.core.CommandInvoker;
import com.payment.command.core.CommandResult;
import com.payment.command.core.CommandSessionRegistry;
import com.payment.command.core.CommandType;
import com.payment.command.core.ErrorCode;
import com.payment.command.core.PaymentCommandFactory;
import com.payment.command.core.RecurringPaymentCommand;
import com.payment.command.core.SubscriptionLocks;
import com.payment.command.domain.Payment;
import com.payment.command.domain.Subscription;
import com.payment.command.messaging.PaymentEventPublisher;
import com.payment.command.persistence.service.SubscriptionPersistenceService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Charges due subscriptions. A scan claims every due subscription, charges the claimed ones
 * on the worker pool and waits for all of them, so the caller gets a complete report. A
 * failure of one subscription is recorded in the report and never stops the others.
 * <p>
 * Each charge runs under the subscription's lock: reload, execute a
 * {@link RecurringPaymentCommand} through its own {@link CommandInvoker}, store the payment and
 * the advanced due date together, then register the invoker so the payment can be refunded.
 */
@Slf4j
@Service
public class RecurringPaymentScheduler {

    private final SubscriptionPersistenceService subscriptionPersistenceService;
    private final PaymentCommandFactory commandFactory;
    private final CommandSessionRegistry sessionRegistry;
    private final SubscriptionLocks locks;
    private final InFlightSubscriptionTracker inFlight;
    private final PaymentEventPublisher eventPublisher;
    private final ComplianceAuditLogger auditLogger;
    private final ExecutorService executor;
    private final long shutdownGracePeriodMs;

    public RecurringPaymentScheduler(SubscriptionPersistenceService subscriptionPersistenceService,
                                     PaymentCommandFactory commandFactory,
                                     CommandSessionRegistry sessionRegistry,
                                     SubscriptionLocks locks,
                                     InFlightSubscriptionTracker inFlight,
                                     PaymentEventPublisher eventPublisher,
                                     ComplianceAuditLogger auditLogger,
                                     @Qualifier(PaymentEngineConfig.RECURRING_PAYMENT_EXECUTOR) ExecutorService executor,
                                     @Value("${payment.scheduler.shutdown-grace-period-ms:30000}") long shutdownGracePeriodMs) {
        this.subscriptionPersistenceService = subscriptionPersistenceService;
        this.commandFactory = commandFactory;
        this.sessionRegistry = sessionRegistry;
        this.locks = locks;
        this.inFlight = inFlight;
        this.eventPublisher = eventPublisher;
        this.auditLogger = auditLogger;
        this.executor = executor;
        this.shutdownGracePeriodMs = shutdownGracePeriodMs;
    }

    /**
     * Charge every subscription due at {@code now}. Subscriptions another scan is still
     * charging are skipped and counted.
     */
    public RecurringScanReport scan(Instant now) {
        List<Subscription> due = subscriptionPersistenceService.findDue(now);
        log.info("Recurring scan at {} found {} due subscription(s)", now, due.size());

        RecurringScanReport.RecurringScanReportBuilder report = RecurringScanReport.builder()
                .scannedAt(now)
                .dueCount(due.size());
        List<QueuedItem> queued = new ArrayList<>();
        int skipped = 0;

        for (Subscription subscription : due) {
            String subscriptionId = subscription.getId();
            if (!inFlight.tryAcquire(subscriptionId)) {
                skipped++;
                log.info("Subscription subscriptionId={} already in flight; skipping", subscriptionId);
                continue;
            }
            try {
                Future<CommandResult> future = executor.submit(() -> processClaimed(subscriptionId, now));
                queued.add(new QueuedItem(subscriptionId, future));
            } catch (RejectedExecutionException e) {
                inFlight.release(subscriptionId);
                log.error("Could not queue charge for subscriptionId={}", subscriptionId, e);
                report.failure(internalFailure(subscriptionId, "Recurring payment worker pool rejected the charge"));
            }
        }

        boolean interrupted = false;
        for (QueuedItem item : queued) {
            if (interrupted) {
                report.failure(internalFailure(item.subscriptionId(), "Scan interrupted before the charge finished"));
                continue;
            }
            try {
                record(report, item.subscriptionId(), item.future().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                log.warn("Recurring scan interrupted while waiting for subscriptionId={}", item.subscriptionId());
                report.failure(internalFailure(item.subscriptionId(), "Scan interrupted before the charge finished"));
            } catch (ExecutionException e) {
                log.error("Charge of subscriptionId={} failed", item.subscriptionId(), e.getCause());
                report.failure(internalFailure(item.subscriptionId(), "Charge failed: " + e.getCause()));
            }
        }

        RecurringScanReport result = report.skippedInFlight(skipped).build();
        log.info("Recurring scan at {} done: due={} payments={} failures={} skippedInFlight={}",
                now, result.getDueCount(), result.getPayments().size(), result.getFailures().size(), skipped);
        return result;
    }

    /**
     * Charge one subscription on the caller's thread, through the same claim and lock as a scan.
     *
     * @throws SubscriptionNotFoundException if no such subscription exists
     */
    public CommandResult processSubscription(String subscriptionId, Instant now) {
        if (subscriptionPersistenceService.findById(subscriptionId).isEmpty()) {
            throw new SubscriptionNotFoundException(subscriptionId);
        }
        if (!inFlight.tryAcquire(subscriptionId)) {
            log.info("Subscription subscriptionId={} already in flight; refusing manual charge", subscriptionId);
            return CommandResult.failure(ErrorCode.SUBSCRIPTION_BUSY,
                    "Subscription " + subscriptionId + " is already being processed");
        }
        return processClaimed(subscriptionId, now);
    }

    private CommandResult processClaimed(String subscriptionId, Instant now) {
        try {
            return locks.withLock(subscriptionId, () -> chargeSubscription(subscriptionId, now));
        } catch (RuntimeException e) {
            log.error("Unexpected error charging subscriptionId={}", subscriptionId, e);
            return CommandResult.failure(ErrorCode.INTERNAL, "Unexpected error charging subscription "
                    + subscriptionId + ": " + e.getMessage());
        } finally {
            inFlight.release(subscriptionId);
        }
    }

    private CommandResult chargeSubscription(String subscriptionId, Instant now) {
        Optional<Subscription> reloaded = subscriptionPersistenceService.findById(subscriptionId);
        if (reloaded.isEmpty()) {
            return CommandResult.failure(ErrorCode.INTERNAL, "Subscription " + subscriptionId + " no longer exists");
        }
        Subscription subscription = reloaded.get();
        Instant previousDueDate = subscription.getNextPaymentDate();

        RecurringPaymentCommand command = commandFactory.recurringPayment(subscription, now);
        CommandInvoker invoker = new CommandInvoker();
        CommandResult result = invoker.execute(command);
        auditLogger.logExecuted(CommandType.RECURRING_PAYMENT, subscriptionId, result);

        if (!result.hasPayment()) {
            return result;
        }
        Payment payment = result.getPayment();
        try {
            subscriptionPersistenceService.recordRecurringCharge(payment, subscription);
        } catch (RuntimeException e) {
            // the stored due date is unchanged, so the next scan charges this installment again
            log.error("Failed to record installment of subscriptionId={} paymentId={} status={} transactionReference={}; "
                            + "stored nextPaymentDate stays {}",
                    subscriptionId, payment.getId(), payment.getStatus(), payment.getTransactionReference(),
                    previousDueDate, e);
            return CommandResult.failure(payment, ErrorCode.INTERNAL,
                    "Payment " + payment.getId() + " was processed but could not be recorded");
        }
        sessionRegistry.register(payment.getId(), invoker);
        eventPublisher.publishExecuted(CommandType.RECURRING_PAYMENT, result);
        return result;
    }

    private static void record(RecurringScanReport.RecurringScanReportBuilder report,
                               String subscriptionId, CommandResult result) {
        if (result.hasPayment()) {
            report.payment(result.getPayment());
        }
        if (!result.isSuccess()) {
            report.failure(new SubscriptionFailure(subscriptionId, result.getError(), result.getPayment()));
        }
    }

    private static SubscriptionFailure internalFailure(String subscriptionId, String message) {
        return new SubscriptionFailure(subscriptionId, CommandError.of(ErrorCode.INTERNAL, message), null);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGracePeriodMs, TimeUnit.MILLISECONDS)) {
                log.warn("Recurring payment workers still running after {} ms; leaving them to finish", shutdownGracePeriodMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for recurring payment workers to finish");
        }
    }

    private record QueuedItem(String subscriptionId, Future<CommandResult> future) {
    }
}

package com.payment.command.core;

import com.payment.command.api.SubscriptionNotFoundException;
import com.payment.command.domain.BillingInterval;
import com.payment.command.domain.Subscription;
import com.payment.command.domain.SubscriptionStatus;
import com.payment.command.persistence.service.PaymentPersistenceService;
import com.payment.command.persistence.service.SubscriptionPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Creates subscriptions and applies explicit status changes. Status changes run under the
 * subscription's lock so they never interleave with a charge of the same subscription.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    public static final String DEFAULT_CURRENCY = "USD";
    public static final BillingInterval DEFAULT_INTERVAL = BillingInterval.MONTHLY;

    private final SubscriptionPersistenceService subscriptionPersistenceService;
    private final PaymentPersistenceService paymentPersistenceService;
    private final SubscriptionLocks locks;
    private final Clock clock;

    /**
     * Create an ACTIVE subscription. Currency defaults to USD, interval to MONTHLY and the
     * first payment date to now.
     *
     * @throws IllegalArgumentException if amount, currency or customer are invalid
     */
    public Subscription createSubscription(BigDecimal amount, String currency, String customerRef,
                                           BillingInterval interval, Instant firstPaymentDate) {
        String effectiveCurrency = currency != null ? currency : DEFAULT_CURRENCY;
        Optional<String> problem = PaymentIntentValidator.validate(amount, effectiveCurrency, customerRef);
        if (problem.isPresent()) {
            throw new IllegalArgumentException(problem.get());
        }
        Instant now = clock.instant();
        Subscription subscription = Subscription.activate(amount, effectiveCurrency, customerRef,
                interval != null ? interval : DEFAULT_INTERVAL,
                firstPaymentDate != null ? firstPaymentDate : now,
                now);
        subscriptionPersistenceService.save(subscription);
        log.info("Created subscription subscriptionId={} customerRef={} amount={} {} interval={} nextPaymentDate={}",
                subscription.getId(), customerRef, amount, effectiveCurrency,
                subscription.getInterval(), subscription.getNextPaymentDate());
        return subscription;
    }

    public Subscription pause(String subscriptionId) {
        return changeStatus(subscriptionId, Subscription::pause);
    }

    public Subscription resume(String subscriptionId) {
        return changeStatus(subscriptionId, Subscription::resume);
    }

    public Subscription cancel(String subscriptionId) {
        return changeStatus(subscriptionId, Subscription::cancel);
    }

    public Subscription getSubscription(String subscriptionId) {
        return subscriptionPersistenceService.findById(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
    }

    public List<Subscription> listSubscriptions(SubscriptionStatus status, String customerRef) {
        return subscriptionPersistenceService.list(status, customerRef);
    }

    public long countPayments(String subscriptionId) {
        return paymentPersistenceService.countBySubscription(subscriptionId);
    }

    private Subscription changeStatus(String subscriptionId, Consumer<Subscription> transition) {
        return locks.withLock(subscriptionId, () -> {
            Subscription subscription = getSubscription(subscriptionId);
            SubscriptionStatus previous = subscription.getStatus();
            transition.accept(subscription);
            subscriptionPersistenceService.save(subscription);
            log.info("Subscription subscriptionId={} status {} -> {}",
                    subscriptionId, previous, subscription.getStatus());
            return subscription;
        });
    }
}

package com.payment.command.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Recurring billing agreement. The scheduler charges it whenever it is
 * {@link SubscriptionStatus#ACTIVE} and {@link #getNextPaymentDate()} has passed, then moves
 * the due date forward by one {@link BillingInterval} from its previous value.
 */
@Getter
@ToString
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Subscription {

    private final String id;
    private final BigDecimal amount;
    private final String currency;
    private final String customerRef;
    private final BillingInterval interval;
    private final Instant createdAt;

    private SubscriptionStatus status;
    private Instant nextPaymentDate;

    public static Subscription activate(BigDecimal amount, String currency, String customerRef,
                                        BillingInterval interval, Instant firstPaymentDate, Instant createdAt) {
        return Subscription.builder()
                .id(UUID.randomUUID().toString())
                .amount(amount)
                .currency(currency)
                .customerRef(customerRef)
                .interval(interval)
                .createdAt(createdAt)
                .status(SubscriptionStatus.ACTIVE)
                .nextPaymentDate(firstPaymentDate)
                .build();
    }

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    public boolean isDue(Instant now) {
        return isActive() && !nextPaymentDate.isAfter(now);
    }

    /**
     * Moves the due date one interval past the previous due date. Only active
     * subscriptions advance.
     */
    public void advanceNextPaymentDate() {
        if (!isActive()) {
            throw new IllegalStateException("Subscription " + id + " is " + status + " and cannot be advanced");
        }
        this.nextPaymentDate = interval.advance(nextPaymentDate);
    }

    public void pause() {
        transitionTo(SubscriptionStatus.PAUSED);
    }

    public void resume() {
        transitionTo(SubscriptionStatus.ACTIVE);
    }

    public void cancel() {
        transitionTo(SubscriptionStatus.CANCELLED);
    }

    private void transitionTo(SubscriptionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStatusTransitionException("Subscription", id, status, target);
        }
        this.status = target;
    }
}

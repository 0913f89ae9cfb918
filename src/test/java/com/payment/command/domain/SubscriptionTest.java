package com.payment.command.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionTest {

    private static final Instant DUE = Instant.parse("2024-01-15T09:00:00Z");

    private Subscription monthly() {
        return Subscription.activate(new BigDecimal("9.99"), "USD", "cust-1", BillingInterval.MONTHLY, DUE, DUE.minusSeconds(60));
    }

    @Test
    void dueOnceNextPaymentDateHasPassed() {
        Subscription subscription = monthly();

        assertThat(subscription.isDue(DUE.minusSeconds(1))).isFalse();
        assertThat(subscription.isDue(DUE)).isTrue();
        assertThat(subscription.isDue(DUE.plusSeconds(3600))).isTrue();
    }

    @Test
    void advanceStartsFromPreviousDueDate() {
        Subscription subscription = monthly();

        subscription.advanceNextPaymentDate();

        assertThat(subscription.getNextPaymentDate()).isEqualTo(Instant.parse("2024-02-15T09:00:00Z"));
    }

    @Test
    void pausedSubscriptionIsNeverDueAndDoesNotAdvance() {
        Subscription subscription = monthly();
        subscription.pause();

        assertThat(subscription.isDue(DUE.plusSeconds(86_400))).isFalse();
        assertThatThrownBy(subscription::advanceNextPaymentDate).isInstanceOf(IllegalStateException.class);
        assertThat(subscription.getNextPaymentDate()).isEqualTo(DUE);
    }

    @Test
    void pauseResumeCancel() {
        Subscription subscription = monthly();

        subscription.pause();
        assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PAUSED);
        subscription.resume();
        assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        subscription.cancel();
        assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
    }

    @Test
    void cancelledIsFinal() {
        Subscription subscription = monthly();
        subscription.cancel();

        assertThatThrownBy(subscription::resume).isInstanceOf(IllegalStatusTransitionException.class);
        assertThatThrownBy(subscription::pause).isInstanceOf(IllegalStatusTransitionException.class);
        assertThatThrownBy(subscription::cancel).isInstanceOf(IllegalStatusTransitionException.class);
    }

    @Test
    void activeCannotBeResumed() {
        assertThatThrownBy(monthly()::resume).isInstanceOf(IllegalStatusTransitionException.class);
    }
}

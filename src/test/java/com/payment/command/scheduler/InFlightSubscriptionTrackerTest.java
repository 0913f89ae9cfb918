package com.payment.command.scheduler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InFlightSubscriptionTrackerTest {

    @Test
    void claimIsExclusiveUntilReleased() {
        InFlightSubscriptionTracker tracker = new InFlightSubscriptionTracker();

        assertThat(tracker.tryAcquire("sub-1")).isTrue();
        assertThat(tracker.tryAcquire("sub-1")).isFalse();
        assertThat(tracker.isInFlight("sub-1")).isTrue();

        tracker.release("sub-1");

        assertThat(tracker.isInFlight("sub-1")).isFalse();
        assertThat(tracker.tryAcquire("sub-1")).isTrue();
    }

    @Test
    void instancesAreIndependent() {
        InFlightSubscriptionTracker first = new InFlightSubscriptionTracker();
        InFlightSubscriptionTracker second = new InFlightSubscriptionTracker();

        first.tryAcquire("sub-1");

        assertThat(second.tryAcquire("sub-1")).isTrue();
        first.clear();
        assertThat(first.size()).isZero();
    }
}

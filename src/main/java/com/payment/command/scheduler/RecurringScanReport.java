package com.payment.command.scheduler;

import com.payment.command.domain.Payment;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one scan over due subscriptions.
 */
@Value
@Builder
public class RecurringScanReport {

    Instant scannedAt;
    /** Subscriptions found due at {@link #scannedAt}. */
    int dueCount;
    /** Every payment the scan produced, declined ones included, in due-date order. */
    @Singular
    List<Payment> payments;
    @Singular
    List<SubscriptionFailure> failures;
    /** Due subscriptions left alone because another scan was already charging them. */
    int skippedInFlight;
}

package com.payment.command.domain;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Billing cadence of a subscription. Dates are advanced on the UTC calendar so there are
 * no daylight-saving shifts. Month and year steps clamp to the last valid day of the
 * target month (Jan 31 + 1 month = Feb 28/29, Feb 29 + 1 year = Feb 28).
 */
public enum BillingInterval {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    /**
     * The due date one interval after {@code from}.
     */
    public Instant advance(Instant from) {
        ZonedDateTime utc = from.atZone(ZoneOffset.UTC);
        switch (this) {
            case DAILY:
                return utc.plusDays(1).toInstant();
            case WEEKLY:
                return utc.plusWeeks(1).toInstant();
            case MONTHLY:
                return utc.plusMonths(1).toInstant();
            case YEARLY:
                return utc.plusYears(1).toInstant();
            default:
                throw new IllegalStateException("Unhandled interval " + this);
        }
    }
}

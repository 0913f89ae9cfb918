package com.payment.command.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BillingIntervalTest {

    @Test
    void advancesByOneCalendarUnit() {
        Instant from = Instant.parse("2024-03-10T08:00:00Z");

        assertThat(BillingInterval.DAILY.advance(from)).isEqualTo(Instant.parse("2024-03-11T08:00:00Z"));
        assertThat(BillingInterval.WEEKLY.advance(from)).isEqualTo(Instant.parse("2024-03-17T08:00:00Z"));
        assertThat(BillingInterval.MONTHLY.advance(from)).isEqualTo(Instant.parse("2024-04-10T08:00:00Z"));
        assertThat(BillingInterval.YEARLY.advance(from)).isEqualTo(Instant.parse("2025-03-10T08:00:00Z"));
    }

    @Test
    void monthlyClampsToLastDayOfShorterMonth() {
        assertThat(BillingInterval.MONTHLY.advance(Instant.parse("2023-01-31T00:00:00Z")))
                .isEqualTo(Instant.parse("2023-02-28T00:00:00Z"));
        assertThat(BillingInterval.MONTHLY.advance(Instant.parse("2024-01-31T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-02-29T00:00:00Z"));
    }

    @Test
    void yearlyFromLeapDayClampsToFebruary28() {
        assertThat(BillingInterval.YEARLY.advance(Instant.parse("2024-02-29T12:00:00Z")))
                .isEqualTo(Instant.parse("2025-02-28T12:00:00Z"));
    }
}

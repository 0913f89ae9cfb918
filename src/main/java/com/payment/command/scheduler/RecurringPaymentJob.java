package com.payment.command.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodic trigger for {@link RecurringPaymentScheduler#scan}. Disable with
 * {@code payment.scheduler.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payment.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class RecurringPaymentJob {

    private final RecurringPaymentScheduler scheduler;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${payment.scheduler.tick-interval-ms:60000}",
            initialDelayString = "${payment.scheduler.initial-delay-ms:10000}")
    public void tick() {
        try {
            scheduler.scan(clock.instant());
        } catch (Exception e) {
            log.error("Recurring payment scan failed", e);
        }
    }
}

package com.payment.command.config;

import com.payment.command.gateway.FixedOutcomePolicy;
import com.payment.command.gateway.GatewayOutcomePolicy;
import com.payment.command.gateway.ProbabilisticOutcomePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring for the command engine: the clock, the simulated gateway's outcome policy and
 * the worker pool that charges due subscriptions.
 */
@Slf4j
@Configuration
public class PaymentEngineConfig {

    public static final String RECURRING_PAYMENT_EXECUTOR = "recurringPaymentExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GatewayOutcomePolicy gatewayOutcomePolicy(
            @Value("${payment.gateway.outcome:random}") String outcome,
            @Value("${payment.gateway.charge-success-rate:0.90}") double chargeSuccessRate,
            @Value("${payment.gateway.refund-success-rate:0.90}") double refundSuccessRate,
            @Value("${payment.gateway.seed:}") String seed) {
        switch (outcome.trim().toLowerCase(Locale.ROOT)) {
            case "always-succeed":
                log.info("Simulated gateway approves every charge and refund");
                return FixedOutcomePolicy.alwaysSucceed();
            case "always-fail":
                log.info("Simulated gateway declines every charge and refund");
                return FixedOutcomePolicy.alwaysFail();
            case "random":
                Random random = seed == null || seed.isBlank() ? new Random() : new Random(Long.parseLong(seed.trim()));
                log.info("Simulated gateway approves charges with p={} and refunds with p={} (seeded={})",
                        chargeSuccessRate, refundSuccessRate, seed != null && !seed.isBlank());
                return new ProbabilisticOutcomePolicy(random, chargeSuccessRate, refundSuccessRate);
            default:
                throw new IllegalArgumentException("Unknown payment.gateway.outcome: " + outcome
                        + " (expected random, always-succeed or always-fail)");
        }
    }

    /**
     * Shut down by {@code RecurringPaymentScheduler}, which waits for in-flight charges first.
     */
    @Bean(name = RECURRING_PAYMENT_EXECUTOR, destroyMethod = "")
    public ExecutorService recurringPaymentExecutor(@Value("${payment.scheduler.worker-threads:4}") int workerThreads) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("payment.scheduler.worker-threads must be positive, was " + workerThreads);
        }
        return Executors.newFixedThreadPool(workerThreads, new CustomizableThreadFactory("recurring-payment-"));
    }
}

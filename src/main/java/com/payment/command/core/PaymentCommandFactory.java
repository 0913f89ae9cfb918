package com.payment.command.core;

import com.payment.command.domain.Subscription;
import com.payment.command.gateway.PaymentGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Builds commands wired to the configured gateway and clock.
 */
@Component
@RequiredArgsConstructor
public class PaymentCommandFactory {

    private final PaymentGateway gateway;
    private final Clock clock;

    public ProcessPaymentCommand processPayment(BigDecimal amount, String currency, String customerRef) {
        return new ProcessPaymentCommand(amount, currency, customerRef, gateway, clock);
    }

    public RecurringPaymentCommand recurringPayment(Subscription subscription, Instant asOf) {
        return new RecurringPaymentCommand(subscription, gateway, clock, asOf);
    }
}

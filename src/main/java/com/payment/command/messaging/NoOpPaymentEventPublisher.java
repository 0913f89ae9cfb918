package com.payment.command.messaging;

import com.payment.command.core.CommandResult;
import com.payment.command.core.CommandType;
import com.payment.command.domain.Payment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when Kafka publishing is disabled. Events are only logged at debug level.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.events.kafka.enabled", havingValue = "false")
public class NoOpPaymentEventPublisher implements PaymentEventPublisher {

    @Override
    public void publishExecuted(CommandType commandType, CommandResult result) {
        log.debug("Event publishing disabled; skipping {} event for paymentId={}",
                commandType, result.hasPayment() ? result.getPayment().getId() : null);
    }

    @Override
    public void publishRefunded(Payment payment) {
        log.debug("Event publishing disabled; skipping refund event for paymentId={}", payment.getId());
    }
}

package com.payment.command.messaging;

import com.payment.command.core.CommandResult;
import com.payment.command.core.CommandType;
import com.payment.command.domain.Payment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes payment lifecycle events to Kafka for audit and downstream consumers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payment.events.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaPaymentEventPublisher implements PaymentEventPublisher {

    private final KafkaTemplate<String, PaymentEvent> kafkaTemplate;
    private final Clock clock;

    @Value("${payment.kafka.topic.payment-events:payment-events}")
    private String topic;

    @Override
    public void publishExecuted(CommandType commandType, CommandResult result) {
        Payment payment = result.getPayment();
        if (payment == null) {
            log.debug("Nothing to publish for {} result without payment: {}", commandType, result.getErrorCode());
            return;
        }
        String eventType = result.isSuccess() ? PaymentEvent.PAYMENT_COMPLETED : PaymentEvent.PAYMENT_FAILED;
        send(toEvent(eventType, commandType, payment,
                result.getErrorCode() != null ? result.getErrorCode().name() : null,
                result.getError() != null ? result.getError().getMessage() : null));
    }

    @Override
    public void publishRefunded(Payment payment) {
        send(toEvent(PaymentEvent.PAYMENT_REFUNDED, null, payment, null, null));
    }

    private PaymentEvent toEvent(String eventType, CommandType commandType, Payment payment,
                                 String errorCode, String message) {
        return PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .commandType(commandType != null ? commandType.name() : null)
                .paymentId(payment.getId())
                .subscriptionId(payment.getSubscriptionId())
                .status(payment.getStatus())
                .transactionReference(payment.getTransactionReference())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .customerRef(payment.getCustomerRef())
                .errorCode(errorCode)
                .message(message)
                .timestamp(clock.instant())
                .build();
    }

    private void send(PaymentEvent event) {
        String key = event.getPaymentId();
        log.info("Publishing payment event: key={}, eventId={}, eventType={}, status={}",
                key, event.getEventId(), event.getEventType(), event.getStatus());
        CompletableFuture<SendResult<String, PaymentEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand payment event to Kafka key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish payment event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published payment event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}

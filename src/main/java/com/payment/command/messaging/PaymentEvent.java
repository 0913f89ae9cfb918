package com.payment.command.messaging;

import com.payment.command.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted for every payment a command produces and for every refund that undoes one.
 * Keyed by payment id so all events of one payment land on the same partition.
 */
@Value
@Builder
@Jacksonized
public class PaymentEvent {

    public static final String PAYMENT_COMPLETED = "PAYMENT_COMPLETED";
    public static final String PAYMENT_FAILED = "PAYMENT_FAILED";
    public static final String PAYMENT_REFUNDED = "PAYMENT_REFUNDED";

    String eventId;
    /** PAYMENT_COMPLETED, PAYMENT_FAILED or PAYMENT_REFUNDED */
    String eventType;
    String commandType;
    String paymentId;
    String subscriptionId;
    PaymentStatus status;
    String transactionReference;
    BigDecimal amount;
    String currency;
    String customerRef;
    String errorCode;
    String message;
    Instant timestamp;
}

package com.payment.command.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single charge attempt. Created {@link PaymentStatus#PENDING} by a command and moved
 * through its state machine only via {@link #markCompleted}, {@link #markFailed} and
 * {@link #markRefunded}. The builder exists for rehydrating stored payments.
 */
@Getter
@ToString
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Payment {

    private final String id;
    private final BigDecimal amount;
    private final String currency;
    private final String customerRef;
    /** Set when the payment was produced for a subscription. */
    private final String subscriptionId;
    private final Instant createdAt;

    private PaymentStatus status;
    /** Gateway reference, present once the charge completed. */
    private String transactionReference;
    private Instant processedAt;

    public static Payment pending(BigDecimal amount, String currency, String customerRef,
                                  String subscriptionId, Instant createdAt) {
        return Payment.builder()
                .id(UUID.randomUUID().toString())
                .amount(amount)
                .currency(currency)
                .customerRef(customerRef)
                .subscriptionId(subscriptionId)
                .createdAt(createdAt)
                .status(PaymentStatus.PENDING)
                .build();
    }

    public void markCompleted(String transactionReference, Instant processedAt) {
        if (transactionReference == null || transactionReference.isBlank()) {
            throw new IllegalArgumentException("Completed payment requires a transaction reference");
        }
        transitionTo(PaymentStatus.COMPLETED);
        this.transactionReference = transactionReference;
        this.processedAt = processedAt;
    }

    public void markFailed() {
        transitionTo(PaymentStatus.FAILED);
    }

    public void markRefunded() {
        transitionTo(PaymentStatus.REFUNDED);
    }

    public boolean isCompleted() {
        return status == PaymentStatus.COMPLETED;
    }

    private void transitionTo(PaymentStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStatusTransitionException("Payment", id, status, target);
        }
        this.status = target;
    }
}

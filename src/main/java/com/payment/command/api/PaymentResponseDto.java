package com.payment.command.api;

import com.payment.command.core.CommandResult;
import com.payment.command.domain.Payment;
import com.payment.command.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * REST API view of a payment, with the command error when the request did not succeed.
 */
@Value
@Builder
public class PaymentResponseDto {

    String id;
    BigDecimal amount;
    String currency;
    PaymentStatus status;
    String transactionReference;
    String customerRef;
    String subscriptionId;
    Instant createdAt;
    Instant processedAt;
    String errorCode;
    String message;

    public static PaymentResponseDto from(Payment payment) {
        if (payment == null) {
            throw new IllegalArgumentException("Payment cannot be null");
        }
        return base(payment).build();
    }

    public static PaymentResponseDto from(CommandResult result) {
        if (result == null || !result.hasPayment()) {
            throw new IllegalArgumentException("CommandResult must carry a payment");
        }
        PaymentResponseDtoBuilder builder = base(result.getPayment());
        if (!result.isSuccess()) {
            builder.errorCode(result.getErrorCode().name())
                    .message(result.getError().getMessage());
        }
        return builder.build();
    }

    private static PaymentResponseDtoBuilder base(Payment payment) {
        return PaymentResponseDto.builder()
                .id(payment.getId())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .status(payment.getStatus())
                .transactionReference(payment.getTransactionReference())
                .customerRef(payment.getCustomerRef())
                .subscriptionId(payment.getSubscriptionId())
                .createdAt(payment.getCreatedAt())
                .processedAt(payment.getProcessedAt());
    }
}

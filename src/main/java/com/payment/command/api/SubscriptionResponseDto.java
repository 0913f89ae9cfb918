package com.payment.command.api;

import com.payment.command.domain.BillingInterval;
import com.payment.command.domain.Subscription;
import com.payment.command.domain.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class SubscriptionResponseDto {

    String id;
    BigDecimal amount;
    String currency;
    String customerRef;
    BillingInterval interval;
    SubscriptionStatus status;
    Instant nextPaymentDate;
    Instant createdAt;
    long paymentsCount;

    public static SubscriptionResponseDto from(Subscription subscription, long paymentsCount) {
        return SubscriptionResponseDto.builder()
                .id(subscription.getId())
                .amount(subscription.getAmount())
                .currency(subscription.getCurrency())
                .customerRef(subscription.getCustomerRef())
                .interval(subscription.getInterval())
                .status(subscription.getStatus())
                .nextPaymentDate(subscription.getNextPaymentDate())
                .createdAt(subscription.getCreatedAt())
                .paymentsCount(paymentsCount)
                .build();
    }
}

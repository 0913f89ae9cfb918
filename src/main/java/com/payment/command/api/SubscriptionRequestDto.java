package com.payment.command.api;

import com.payment.command.domain.BillingInterval;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * REST API request body for creating a subscription. Currency defaults to USD, interval to
 * MONTHLY and the first payment date to now.
 */
@Data
public class SubscriptionRequestDto {

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    private String currency;

    @NotBlank(message = "customerRef is required")
    private String customerRef;

    private BillingInterval interval;

    private Instant nextPaymentDate;
}

package com.payment.command.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST API request body for a one-off payment. Amount and currency are checked by the
 * command itself, which answers INVALID_ARGUMENT for values it cannot charge.
 */
@Data
public class ProcessPaymentRequestDto {

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    /** ISO 4217 code; USD when omitted. */
    private String currency = "USD";

    @NotBlank(message = "customerRef is required")
    private String customerRef;
}

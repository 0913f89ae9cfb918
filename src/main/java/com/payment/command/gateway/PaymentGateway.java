package com.payment.command.gateway;

import java.math.BigDecimal;

/**
 * Contract every payment processor integration implements. Commands talk to the
 * processor only through this interface, so a real network integration can replace the
 * simulator without touching the command flow.
 * <p>
 * Implementations return declines and refund failures as results; they never throw for
 * a business outcome.
 */
public interface PaymentGateway {

    /**
     * Name used in logs and audit lines (like "SimulatedPaymentGateway").
     */
    default String getGatewayName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Charge the customer.
     *
     * @param amount      positive amount in major units
     * @param currency    ISO 4217 code
     * @param customerRef customer identifier
     * @return approved result with a fresh unique reference, or a declined result without one
     */
    GatewayChargeResult charge(BigDecimal amount, String currency, String customerRef);

    /**
     * Refund a completed charge in full.
     *
     * @param transactionReference reference returned by {@link #charge}
     * @return refund outcome (never null)
     */
    GatewayRefundResult refund(String transactionReference);
}

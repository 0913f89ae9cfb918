package com.payment.command.gateway;

/**
 * Decides whether the simulated processor approves a call. Injected into
 * {@link SimulatedPaymentGateway} so tests can pin outcomes without touching the gateway.
 */
public interface GatewayOutcomePolicy {

    boolean approveCharge();

    boolean approveRefund();
}

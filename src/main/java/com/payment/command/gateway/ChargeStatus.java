package com.payment.command.gateway;

/**
 * Outcome of a gateway charge.
 */
public enum ChargeStatus {
    APPROVED,
    DECLINED
}

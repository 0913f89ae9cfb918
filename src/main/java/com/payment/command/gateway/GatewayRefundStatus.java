package com.payment.command.gateway;

/**
 * Outcome of a gateway refund.
 */
public enum GatewayRefundStatus {
    /** Refund accepted; the original reference can no longer be refunded. */
    SUCCEEDED,
    /** Reference was never charged here or has already been refunded. */
    UNKNOWN_REFERENCE,
    /** Processor rejected the refund; the reference stays refundable. */
    FAILED
}

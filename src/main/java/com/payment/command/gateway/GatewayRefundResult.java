package com.payment.command.gateway;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What the gateway answered to a refund of a previously charged transaction.
 */
@Value
@Builder
public class GatewayRefundResult {

    GatewayRefundStatus status;
    /** Reference of the charge being refunded. */
    String transactionReference;
    /** Reference of the refund itself, present on success. */
    String refundReference;
    String failureCode;
    String message;
    Instant timestamp;

    public boolean isSucceeded() {
        return status == GatewayRefundStatus.SUCCEEDED;
    }
}

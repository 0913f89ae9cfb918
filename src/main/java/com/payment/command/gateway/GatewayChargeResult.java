package com.payment.command.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What the gateway answered to a charge. Declined charges carry no transaction reference.
 */
@Value
@Builder
public class GatewayChargeResult {

    ChargeStatus status;
    String transactionReference;
    BigDecimal amount;
    String currency;
    String customerRef;
    String failureCode;
    String message;
    Instant timestamp;

    public boolean isApproved() {
        return status == ChargeStatus.APPROVED;
    }
}

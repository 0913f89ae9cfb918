package com.payment.command.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single charge. A payment starts {@link #PENDING}, settles into
 * {@link #COMPLETED} or {@link #FAILED}, and a completed payment may be {@link #REFUNDED}
 * once. Failed and refunded payments are terminal.
 */
public enum PaymentStatus {
    /** Created by a command, gateway not yet answered. */
    PENDING,
    /** Gateway approved the charge; a transaction reference is attached. */
    COMPLETED,
    /** Gateway declined the charge. */
    FAILED,
    /** Charge was reversed through the gateway. */
    REFUNDED;

    public boolean canTransitionTo(PaymentStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<PaymentStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(COMPLETED, FAILED);
            case COMPLETED:
                return EnumSet.of(REFUNDED);
            default:
                return EnumSet.noneOf(PaymentStatus.class);
        }
    }
}

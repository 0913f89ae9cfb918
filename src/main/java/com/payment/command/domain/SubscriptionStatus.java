package com.payment.command.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a recurring billing agreement. Only {@link #ACTIVE} subscriptions are
 * picked up by the scheduler; {@link #CANCELLED} is terminal.
 */
public enum SubscriptionStatus {
    ACTIVE,
    PAUSED,
    CANCELLED;

    public boolean canTransitionTo(SubscriptionStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<SubscriptionStatus> allowedTargets() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(PAUSED, CANCELLED);
            case PAUSED:
                return EnumSet.of(ACTIVE, CANCELLED);
            default:
                return EnumSet.noneOf(SubscriptionStatus.class);
        }
    }
}

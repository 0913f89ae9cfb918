package com.payment.command.gateway;

/**
 * Always gives the same answer. Used for demos (payment.gateway.outcome=always-succeed)
 * and deterministic tests.
 */
public class FixedOutcomePolicy implements GatewayOutcomePolicy {

    private final boolean approveCharges;
    private final boolean approveRefunds;

    public FixedOutcomePolicy(boolean approveCharges, boolean approveRefunds) {
        this.approveCharges = approveCharges;
        this.approveRefunds = approveRefunds;
    }

    public static FixedOutcomePolicy alwaysSucceed() {
        return new FixedOutcomePolicy(true, true);
    }

    public static FixedOutcomePolicy alwaysFail() {
        return new FixedOutcomePolicy(false, false);
    }

    @Override
    public boolean approveCharge() {
        return approveCharges;
    }

    @Override
    public boolean approveRefund() {
        return approveRefunds;
    }
}

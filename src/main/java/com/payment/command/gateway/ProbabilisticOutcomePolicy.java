package com.payment.command.gateway;

import java.util.Random;

/**
 * Approves each call independently with a fixed probability. Pass a seeded
 * {@link Random} to replay the same approve/decline sequence.
 */
public class ProbabilisticOutcomePolicy implements GatewayOutcomePolicy {

    public static final double DEFAULT_SUCCESS_RATE = 0.90;

    private final Random random;
    private final double chargeSuccessRate;
    private final double refundSuccessRate;

    public ProbabilisticOutcomePolicy(Random random, double chargeSuccessRate, double refundSuccessRate) {
        this.random = random;
        this.chargeSuccessRate = requireRate("chargeSuccessRate", chargeSuccessRate);
        this.refundSuccessRate = requireRate("refundSuccessRate", refundSuccessRate);
    }

    public ProbabilisticOutcomePolicy(Random random) {
        this(random, DEFAULT_SUCCESS_RATE, DEFAULT_SUCCESS_RATE);
    }

    @Override
    public boolean approveCharge() {
        return random.nextDouble() < chargeSuccessRate;
    }

    @Override
    public boolean approveRefund() {
        return random.nextDouble() < refundSuccessRate;
    }

    private static double requireRate(String name, double rate) {
        if (rate < 0.0 || rate > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1, was " + rate);
        }
        return rate;
    }
}

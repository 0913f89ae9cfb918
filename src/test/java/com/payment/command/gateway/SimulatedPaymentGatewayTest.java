package com.payment.command.gateway;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedPaymentGatewayTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private SimulatedPaymentGateway gateway(GatewayOutcomePolicy policy) {
        return new SimulatedPaymentGateway(policy, clock, 0);
    }

    @Test
    void approvedChargesGetUniqueReferences() {
        SimulatedPaymentGateway gateway = gateway(FixedOutcomePolicy.alwaysSucceed());
        Set<String> references = new HashSet<>();

        for (int i = 0; i < 50; i++) {
            GatewayChargeResult result = gateway.charge(new BigDecimal("10.00"), "USD", "cust-" + i);
            assertThat(result.isApproved()).isTrue();
            assertThat(result.getTransactionReference()).startsWith("txn_").hasSize(20);
            references.add(result.getTransactionReference());
        }

        assertThat(references).hasSize(50);
    }

    @Test
    void declinedChargeHasNoReference() {
        GatewayChargeResult result = gateway(FixedOutcomePolicy.alwaysFail())
                .charge(new BigDecimal("10.00"), "USD", "cust-1");

        assertThat(result.getStatus()).isEqualTo(ChargeStatus.DECLINED);
        assertThat(result.getTransactionReference()).isNull();
        assertThat(result.getFailureCode()).isEqualTo("CARD_DECLINED");
        assertThat(result.getMessage()).contains("declined");
    }

    @Test
    void refundSucceedsOncePerReference() {
        SimulatedPaymentGateway gateway = gateway(FixedOutcomePolicy.alwaysSucceed());
        String reference = gateway.charge(new BigDecimal("10.00"), "USD", "cust-1").getTransactionReference();

        GatewayRefundResult first = gateway.refund(reference);
        GatewayRefundResult second = gateway.refund(reference);

        assertThat(first.isSucceeded()).isTrue();
        assertThat(first.getRefundReference()).startsWith("rfnd_");
        assertThat(second.getStatus()).isEqualTo(GatewayRefundStatus.UNKNOWN_REFERENCE);
    }

    @Test
    void unknownReferenceIsRejected() {
        GatewayRefundResult result = gateway(FixedOutcomePolicy.alwaysSucceed()).refund("txn_doesnotexist0000");

        assertThat(result.getStatus()).isEqualTo(GatewayRefundStatus.UNKNOWN_REFERENCE);
        assertThat(result.getFailureCode()).isEqualTo("INVALID_REFERENCE");
    }

    @Test
    void failedRefundKeepsReferenceRefundable() {
        SimulatedPaymentGateway gateway = gateway(new FixedOutcomePolicy(true, false));
        String reference = gateway.charge(new BigDecimal("10.00"), "USD", "cust-1").getTransactionReference();

        GatewayRefundResult result = gateway.refund(reference);

        assertThat(result.getStatus()).isEqualTo(GatewayRefundStatus.FAILED);
        assertThat(result.getRefundReference()).isNull();
    }

    @Test
    void oldestUnrefundedChargeIsForgottenWhenCapacityIsReached() {
        SimulatedPaymentGateway gateway = new SimulatedPaymentGateway(FixedOutcomePolicy.alwaysSucceed(), clock, 0, 2);
        String oldest = gateway.charge(new BigDecimal("1.00"), "USD", "cust-1").getTransactionReference();
        String middle = gateway.charge(new BigDecimal("2.00"), "USD", "cust-2").getTransactionReference();
        String newest = gateway.charge(new BigDecimal("3.00"), "USD", "cust-3").getTransactionReference();

        assertThat(gateway.refund(oldest).getStatus()).isEqualTo(GatewayRefundStatus.UNKNOWN_REFERENCE);
        assertThat(gateway.refund(middle).isSucceeded()).isTrue();
        assertThat(gateway.refund(newest).isSucceeded()).isTrue();
    }

    @Test
    void nonPositiveRefundableCapacityIsRejected() {
        assertThatThrownBy(() -> new SimulatedPaymentGateway(FixedOutcomePolicy.alwaysSucceed(), clock, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refundable-capacity");
    }

    @Test
    void seededPolicyReplaysSameOutcomes() {
        ProbabilisticOutcomePolicy first = new ProbabilisticOutcomePolicy(new Random(42));
        ProbabilisticOutcomePolicy second = new ProbabilisticOutcomePolicy(new Random(42));

        for (int i = 0; i < 100; i++) {
            assertThat(first.approveCharge()).isEqualTo(second.approveCharge());
        }
    }

    @Test
    void defaultRateApprovesRoughlyNinetyPercent() {
        ProbabilisticOutcomePolicy policy = new ProbabilisticOutcomePolicy(new Random(7));
        int approved = 0;
        for (int i = 0; i < 10_000; i++) {
            if (policy.approveCharge()) {
                approved++;
            }
        }

        assertThat(approved).isBetween(8_700, 9_300);
    }
}

package com.payment.command.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * In-process stand-in for a card processor. Every charge and refund is approved or
 * rejected by the injected {@link GatewayOutcomePolicy}; no network I/O happens.
 * Approved charges are remembered so a refund of an unknown or already-refunded
 * reference can be told apart from a processor failure. Only the most recent
 * {@code refundableCapacity} unrefunded charges are remembered; older references are
 * answered as unknown.
 */
@Slf4j
@Component
public class SimulatedPaymentGateway implements PaymentGateway {

    static final String CHARGE_PREFIX = "txn_";
    static final String REFUND_PREFIX = "rfnd_";
    static final int DEFAULT_REFUNDABLE_CAPACITY = 100_000;

    private final GatewayOutcomePolicy outcomePolicy;
    private final Clock clock;
    private final long simulatedLatencyMs;

    private final int refundableCapacity;

    /** References charged here and not yet refunded, oldest first. */
    private final Set<String> refundableReferences;

    @Autowired
    public SimulatedPaymentGateway(GatewayOutcomePolicy outcomePolicy,
                                   Clock clock,
                                   @Value("${payment.gateway.simulated-latency-ms:0}") long simulatedLatencyMs,
                                   @Value("${payment.gateway.refundable-capacity:100000}") int refundableCapacity) {
        if (refundableCapacity <= 0) {
            throw new IllegalArgumentException("payment.gateway.refundable-capacity must be positive, was " + refundableCapacity);
        }
        this.outcomePolicy = outcomePolicy;
        this.clock = clock;
        this.simulatedLatencyMs = simulatedLatencyMs;
        this.refundableCapacity = refundableCapacity;
        this.refundableReferences = Collections.synchronizedSet(Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                boolean evict = size() > SimulatedPaymentGateway.this.refundableCapacity;
                if (evict) {
                    log.debug("Refundable reference capacity {} reached; forgetting transactionReference={}",
                            SimulatedPaymentGateway.this.refundableCapacity, eldest.getKey());
                }
                return evict;
            }
        }));
    }

    public SimulatedPaymentGateway(GatewayOutcomePolicy outcomePolicy, Clock clock, long simulatedLatencyMs) {
        this(outcomePolicy, clock, simulatedLatencyMs, DEFAULT_REFUNDABLE_CAPACITY);
    }

    @Override
    public GatewayChargeResult charge(BigDecimal amount, String currency, String customerRef) {
        simulateLatency();
        log.debug("Simulated gateway charging amount={} {} customerRef={}", amount, currency, customerRef);

        if (!outcomePolicy.approveCharge()) {
            return GatewayChargeResult.builder()
                    .status(ChargeStatus.DECLINED)
                    .transactionReference(null)
                    .amount(amount)
                    .currency(currency)
                    .customerRef(customerRef)
                    .failureCode("CARD_DECLINED")
                    .message("Payment processing failed - insufficient funds or card declined")
                    .timestamp(clock.instant())
                    .build();
        }

        String reference = newReference(CHARGE_PREFIX);
        refundableReferences.add(reference);
        return GatewayChargeResult.builder()
                .status(ChargeStatus.APPROVED)
                .transactionReference(reference)
                .amount(amount)
                .currency(currency)
                .customerRef(customerRef)
                .failureCode(null)
                .message("Payment processed successfully")
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public GatewayRefundResult refund(String transactionReference) {
        simulateLatency();
        log.debug("Simulated gateway refunding transactionReference={}", transactionReference);

        if (transactionReference == null || !refundableReferences.contains(transactionReference)) {
            return unknownReference(transactionReference);
        }
        if (!outcomePolicy.approveRefund()) {
            return GatewayRefundResult.builder()
                    .status(GatewayRefundStatus.FAILED)
                    .transactionReference(transactionReference)
                    .refundReference(null)
                    .failureCode("REFUND_DECLINED")
                    .message("Refund processing failed")
                    .timestamp(clock.instant())
                    .build();
        }
        // a concurrent refund of the same reference may have won in between
        if (!refundableReferences.remove(transactionReference)) {
            return unknownReference(transactionReference);
        }
        return GatewayRefundResult.builder()
                .status(GatewayRefundStatus.SUCCEEDED)
                .transactionReference(transactionReference)
                .refundReference(newReference(REFUND_PREFIX))
                .failureCode(null)
                .message("Refund processed successfully")
                .timestamp(clock.instant())
                .build();
    }

    private GatewayRefundResult unknownReference(String transactionReference) {
        return GatewayRefundResult.builder()
                .status(GatewayRefundStatus.UNKNOWN_REFERENCE)
                .transactionReference(transactionReference)
                .refundReference(null)
                .failureCode("INVALID_REFERENCE")
                .message("Unknown or already refunded transaction reference: " + transactionReference)
                .timestamp(clock.instant())
                .build();
    }

    private static String newReference(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private void simulateLatency() {
        if (simulatedLatencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(simulatedLatencyMs);
        } catch (InterruptedException e) {
            // finish the call so the caller can record its outcome; keep the interrupt for the caller
            Thread.currentThread().interrupt();
        }
    }
}

package com.payment.command.persistence;

import com.payment.command.domain.Payment;
import com.payment.command.domain.PaymentStatus;
import com.payment.command.persistence.service.PaymentPersistenceService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(PaymentPersistenceService.class)
class PaymentPersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired private PaymentPersistenceService paymentPersistenceService;

    private Payment completed(String customerRef, Instant createdAt, String reference) {
        Payment payment = Payment.pending(new BigDecimal("30.00"), "USD", customerRef, null, createdAt);
        payment.markCompleted(reference, createdAt);
        paymentPersistenceService.save(payment);
        return payment;
    }

    @Test
    void saveUpdatesExistingPayment() {
        Payment payment = completed("cust-1", NOW, "txn_1");
        payment.markRefunded();

        paymentPersistenceService.save(payment);

        Payment reloaded = paymentPersistenceService.findById(payment.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(reloaded.getTransactionReference()).isEqualTo("txn_1");
        assertThat(reloaded.getAmount()).isEqualByComparingTo("30.00");
        assertThat(reloaded.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void listFiltersByStatusAndCustomerNewestFirst() {
        Payment older = completed("cust-1", NOW.minusSeconds(120), "txn_a");
        Payment newer = completed("cust-1", NOW, "txn_b");
        completed("cust-2", NOW, "txn_c");
        Payment failed = Payment.pending(new BigDecimal("5.00"), "USD", "cust-1", null, NOW.minusSeconds(60));
        failed.markFailed();
        paymentPersistenceService.save(failed);

        List<Payment> completedForCustomer = paymentPersistenceService.list(PaymentStatus.COMPLETED, "cust-1");
        List<Payment> allForCustomer = paymentPersistenceService.list(null, "cust-1");

        assertThat(completedForCustomer).extracting(Payment::getId).containsExactly(newer.getId(), older.getId());
        assertThat(allForCustomer).extracting(Payment::getId).containsExactly(newer.getId(), failed.getId(), older.getId());
        assertThat(paymentPersistenceService.list(PaymentStatus.FAILED, null)).hasSize(1);
        assertThat(paymentPersistenceService.list(null, null)).hasSize(4);
    }
}

package com.payment.command;

import com.jayway.jsonpath.JsonPath;
import com.payment.command.core.CommandSessionRegistry;
import com.payment.command.scheduler.InFlightSubscriptionTracker;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end flows against the full context on H2, with the simulated gateway approving
 * everything, Kafka publishing off and the periodic job disabled.
 */
@Tag("integration")
@SpringBootTest
@AutoConfigureMockMvc
class PaymentCommandApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CommandSessionRegistry sessionRegistry;

    @Autowired
    private InFlightSubscriptionTracker inFlightSubscriptionTracker;

    @Test
    void chargeThenRefundOnce() throws Exception {
        String body = mockMvc.perform(post("/api/v1/payments/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 99.99, "currency": "USD", "customerRef": "e2e-refund"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andReturn().getResponse().getContentAsString();
        String paymentId = JsonPath.read(body, "$.id");
        String reference = JsonPath.read(body, "$.transactionReference");
        assertThat(reference).startsWith("txn_");
        assertThat(sessionRegistry.find(paymentId)).isPresent();

        mockMvc.perform(post("/api/v1/payments/{id}/refund", paymentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REFUNDED"))
                .andExpect(jsonPath("$.transactionReference").value(reference));

        mockMvc.perform(post("/api/v1/payments/{id}/refund", paymentId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("NO_COMMAND_TO_UNDO"));

        mockMvc.perform(get("/api/v1/payments/{id}", paymentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REFUNDED"));
    }

    @Test
    void invalidCurrencyCreatesNoPayment() throws Exception {
        mockMvc.perform(post("/api/v1/payments/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 10.00, "currency": "ZZZ", "customerRef": "e2e-invalid"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/api/v1/payments").param("customerRef", "e2e-invalid"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void recurringScanChargesDueSubscriptionOnce() throws Exception {
        Instant due = Instant.now().minus(2, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        String created = mockMvc.perform(post("/api/v1/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 12.00, "customerRef": "e2e-recurring", "interval": "WEEKLY", "nextPaymentDate": "%s"}
                                """.formatted(due)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String subscriptionId = JsonPath.read(created, "$.id");

        mockMvc.perform(post("/api/v1/payments/process-recurring"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processedCount").value(1))
                .andExpect(jsonPath("$.payments[0].subscriptionId").value(subscriptionId))
                .andExpect(jsonPath("$.payments[0].status").value("COMPLETED"));

        mockMvc.perform(get("/api/v1/subscriptions/{id}", subscriptionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nextPaymentDate").value(due.plus(7, ChronoUnit.DAYS).toString()))
                .andExpect(jsonPath("$.paymentsCount").value(1));

        mockMvc.perform(post("/api/v1/payments/process-recurring"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processedCount").value(0));

        mockMvc.perform(post("/api/v1/subscriptions/{id}/process", subscriptionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SUBSCRIPTION_NOT_DUE"));
        assertThat(inFlightSubscriptionTracker.size()).isZero();
    }

    @Test
    void pausedSubscriptionIsNotCharged() throws Exception {
        String created = mockMvc.perform(post("/api/v1/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 5.00, "currency": "EUR", "customerRef": "e2e-paused", "interval": "DAILY"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.currency").value("EUR"))
                .andReturn().getResponse().getContentAsString();
        String subscriptionId = JsonPath.read(created, "$.id");

        mockMvc.perform(post("/api/v1/subscriptions/{id}/pause", subscriptionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAUSED"));

        mockMvc.perform(post("/api/v1/subscriptions/{id}/process", subscriptionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SUBSCRIPTION_NOT_ACTIVE"));

        mockMvc.perform(post("/api/v1/subscriptions/{id}/pause", subscriptionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ILLEGAL_TRANSITION"));

        mockMvc.perform(get("/api/v1/payments").param("customerRef", "e2e-paused"))
                .andExpect(jsonPath("$.length()").value(0));
    }
}

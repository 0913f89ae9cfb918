package com.payment.command;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the payment command engine. Enables:
 * <ul>
 *   <li>One-off payments and refunds as undoable commands</li>
 *   <li>Subscriptions charged by a scheduled recurring scan</li>
 *   <li>Kafka events for every payment and refund</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class PaymentCommandApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentCommandApplication.class, args);
    }
}

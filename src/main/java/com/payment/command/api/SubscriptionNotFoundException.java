package com.payment.command.api;

/**
 * Thrown when a subscription id does not exist. Handler returns HTTP 404.
 */
public class SubscriptionNotFoundException extends RuntimeException {

    public SubscriptionNotFoundException(String subscriptionId) {
        super("Subscription not found: " + subscriptionId);
    }
}

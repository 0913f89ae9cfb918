package com.payment.command.core;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-subscription mutual exclusion. Charging an installment (execute, advance, persist)
 * and status changes of the same subscription run under the same lock, so neither sees
 * the other half-done. Locks are striped by subscription id; two subscriptions may share
 * a stripe, which only costs concurrency.
 */
@Component
public class SubscriptionLocks {

    private final ReentrantLock[] stripes;

    public SubscriptionLocks(@Value("${payment.subscriptions.lock-stripes:64}") int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("payment.subscriptions.lock-stripes must be positive, was " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String subscriptionId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(subscriptionId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(String subscriptionId) {
        return stripes[Math.floorMod(subscriptionId.hashCode(), stripes.length)];
    }
}

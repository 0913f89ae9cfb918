package com.payment.command.scheduler;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Subscriptions currently being charged. A subscription is claimed before its work item is
 * queued and released when the item finishes, so overlapping scans never charge it twice.
 */
@Component
public class InFlightSubscriptionTracker {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /** @return {@code true} if the caller now owns the claim */
    public boolean tryAcquire(String subscriptionId) {
        return inFlight.add(subscriptionId);
    }

    public void release(String subscriptionId) {
        inFlight.remove(subscriptionId);
    }

    public boolean isInFlight(String subscriptionId) {
        return inFlight.contains(subscriptionId);
    }

    public int size() {
        return inFlight.size();
    }

    public void clear() {
        inFlight.clear();
    }
}

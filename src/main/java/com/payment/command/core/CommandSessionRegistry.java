package com.payment.command.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the invoker that executed each payment's command so a later refund request can
 * undo exactly that command. Bounded: once full, the least recently used session is
 * dropped and its payment can no longer be undone.
 */
@Slf4j
@Component
public class CommandSessionRegistry {

    private final int capacity;
    private final Map<String, CommandInvoker> sessions;

    public CommandSessionRegistry(@Value("${payment.commands.session-capacity:10000}") int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("payment.commands.session-capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.sessions = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CommandInvoker> eldest) {
                boolean evict = size() > CommandSessionRegistry.this.capacity;
                if (evict) {
                    log.info("Command session capacity {} reached; dropping session for paymentId={}",
                            CommandSessionRegistry.this.capacity, eldest.getKey());
                }
                return evict;
            }
        };
    }

    public synchronized void register(String paymentId, CommandInvoker invoker) {
        sessions.put(paymentId, invoker);
    }

    public synchronized Optional<CommandInvoker> find(String paymentId) {
        return Optional.ofNullable(sessions.get(paymentId));
    }

    public synchronized void remove(String paymentId) {
        sessions.remove(paymentId);
    }

    public synchronized int size() {
        return sessions.size();
    }
}

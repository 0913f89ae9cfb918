package com.payment.command.domain;

/**
 * Thrown when a payment or subscription is asked to move to a status its state machine
 * does not allow from the current one. Handler returns HTTP 409.
 */
public class IllegalStatusTransitionException extends RuntimeException {

    public IllegalStatusTransitionException(String entity, String id, Enum<?> from, Enum<?> to) {
        super(String.format("%s %s cannot move from %s to %s", entity, id, from, to));
    }
}

package com.payment.command.core;

/**
 * Distinguishable failure kinds of a command. Every failed {@link CommandResult}
 * carries exactly one.
 */
public enum ErrorCode {
    /** Bad amount, currency or customer reference; nothing was charged. */
    INVALID_ARGUMENT,
    /** Processor declined the charge; the payment is recorded as FAILED. */
    GATEWAY_DECLINED,
    /** Refund of a reference the processor does not know or already refunded. */
    INVALID_REFERENCE,
    /** Processor rejected the refund; the payment stays COMPLETED. */
    REFUND_FAILED,
    SUBSCRIPTION_NOT_ACTIVE,
    SUBSCRIPTION_NOT_DUE,
    /** Subscription is being charged by another scan. */
    SUBSCRIPTION_BUSY,
    /** Nothing executed yet, or the last command was already undone. */
    NO_COMMAND_TO_UNDO,
    /** The last command did not complete its payment, so there is nothing to refund. */
    COMMAND_NOT_SUCCESSFUL,
    /** Unexpected failure; fatal to the single operation only. */
    INTERNAL
}

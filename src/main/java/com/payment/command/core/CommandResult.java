package com.payment.command.core;

import com.payment.command.domain.Payment;
import lombok.Value;

/**
 * Outcome of executing or undoing a command. A declined charge is a failure that still
 * carries its FAILED payment; a validation failure carries no payment at all.
 */
@Value
public class CommandResult {

    Payment payment;
    CommandError error;

    public static CommandResult success(Payment payment) {
        return new CommandResult(payment, null);
    }

    public static CommandResult failure(ErrorCode code, String message) {
        return new CommandResult(null, CommandError.of(code, message));
    }

    public static CommandResult failure(Payment payment, ErrorCode code, String message) {
        return new CommandResult(payment, CommandError.of(code, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasPayment() {
        return payment != null;
    }

    public ErrorCode getErrorCode() {
        return error != null ? error.getCode() : null;
    }
}

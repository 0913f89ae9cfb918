package com.payment.command.core;

import lombok.Value;

/**
 * Failure reported by a command, the invoker or the scheduler.
 */
@Value
public class CommandError {

    ErrorCode code;
    String message;

    public static CommandError of(ErrorCode code, String message) {
        return new CommandError(code, message);
    }
}

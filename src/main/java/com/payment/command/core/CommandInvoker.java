package com.payment.command.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Runs commands and remembers only the most recent one for undo. Every {@link #execute}
 * overwrites that slot, whatever the outcome of the previous command, and a successful
 * {@link #undoLast()} clears it, so each successful execution can be undone at most once.
 * <p>
 * The slot is guarded by the instance monitor. Callers normally give each execution
 * context its own invoker.
 */
@Slf4j
public class CommandInvoker {

    private PaymentCommand lastExecuted;

    /**
     * Execute the command and record it as the last executed one. Unexpected exceptions
     * become an {@link ErrorCode#INTERNAL} result; the command's own result is returned
     * unchanged otherwise.
     */
    public synchronized CommandResult execute(PaymentCommand command) {
        log.info("Executing command: {}", command);
        CommandResult result;
        try {
            result = command.execute();
        } catch (RuntimeException e) {
            log.error("Command execution failed: {}", command, e);
            result = CommandResult.failure(command.getPayment(), ErrorCode.INTERNAL,
                    "Command execution failed: " + messageOf(e));
        }
        lastExecuted = command;

        if (result.isSuccess()) {
            log.info("Command executed successfully: {}", command);
        } else {
            log.warn("Command finished with error {}: {}", result.getErrorCode(), result.getError().getMessage());
        }
        return result;
    }

    /**
     * Undo the last executed command. Fails with {@link ErrorCode#NO_COMMAND_TO_UNDO} when
     * nothing was executed or it was already undone, and with
     * {@link ErrorCode#COMMAND_NOT_SUCCESSFUL} when the last execution did not complete its
     * payment; the gateway is not called in either case.
     */
    public synchronized CommandResult undoLast() {
        if (lastExecuted == null) {
            log.warn("No command to undo");
            return CommandResult.failure(ErrorCode.NO_COMMAND_TO_UNDO, "No command to undo");
        }
        PaymentCommand command = lastExecuted;
        if (!command.succeeded()) {
            log.warn("Last command did not succeed, refusing undo: {}", command);
            return CommandResult.failure(command.getPayment(), ErrorCode.COMMAND_NOT_SUCCESSFUL,
                    "Last command did not complete a payment: " + command);
        }

        log.info("Undoing command: {}", command);
        CommandResult result;
        try {
            result = command.undo();
        } catch (RuntimeException e) {
            log.error("Command undo failed: {}", command, e);
            return CommandResult.failure(command.getPayment(), ErrorCode.INTERNAL,
                    "Command undo failed: " + messageOf(e));
        }

        if (result.isSuccess()) {
            lastExecuted = null;
            log.info("Command undone successfully: {}", command);
        } else {
            log.warn("Command undo finished with error {}: {}", result.getErrorCode(), result.getError().getMessage());
        }
        return result;
    }

    public synchronized Optional<PaymentCommand> getLastExecuted() {
        return Optional.ofNullable(lastExecuted);
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

package com.payment.command.core;

import com.payment.command.domain.PaymentStatus;
import com.payment.command.gateway.FixedOutcomePolicy;
import com.payment.command.gateway.PaymentGateway;
import com.payment.command.gateway.SimulatedPaymentGateway;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CommandInvokerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private ProcessPaymentCommand command(PaymentGateway gateway, String amount) {
        return new ProcessPaymentCommand(new BigDecimal(amount), "USD", "cust-1", gateway, clock);
    }

    @Test
    void undoWithNothingExecutedFails() {
        CommandInvoker invoker = new CommandInvoker();

        CommandResult result = invoker.undoLast();

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NO_COMMAND_TO_UNDO);
        assertThat(invoker.getLastExecuted()).isEmpty();
    }

    @Test
    void successfulCommandCanBeUndoneExactlyOnce() {
        PaymentGateway gateway = new SimulatedPaymentGateway(FixedOutcomePolicy.alwaysSucceed(), clock, 0);
        CommandInvoker invoker = new CommandInvoker();
        invoker.execute(command(gateway, "20.00"));

        CommandResult first = invoker.undoLast();
        CommandResult second = invoker.undoLast();

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.getPayment().getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(second.getErrorCode()).isEqualTo(ErrorCode.NO_COMMAND_TO_UNDO);
    }

    @Test
    void undoAfterDeclinedExecutionDoesNotCallGateway() {
        PaymentGateway gateway = spy(new SimulatedPaymentGateway(FixedOutcomePolicy.alwaysFail(), clock, 0));
        CommandInvoker invoker = new CommandInvoker();
        invoker.execute(command(gateway, "20.00"));

        CommandResult result = invoker.undoLast();

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.COMMAND_NOT_SUCCESSFUL);
        assertThat(result.getPayment().getStatus()).isEqualTo(PaymentStatus.FAILED);
        verify(gateway, never()).refund(anyString());
    }

    @Test
    void undoAfterInvalidExecutionDoesNotCallGateway() {
        PaymentGateway gateway = mock(PaymentGateway.class);
        CommandInvoker invoker = new CommandInvoker();
        invoker.execute(command(gateway, "0"));

        CommandResult result = invoker.undoLast();

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.COMMAND_NOT_SUCCESSFUL);
        verifyNoInteractions(gateway);
    }

    @Test
    void onlyMostRecentCommandIsRemembered() {
        PaymentGateway gateway = new SimulatedPaymentGateway(FixedOutcomePolicy.alwaysSucceed(), clock, 0);
        CommandInvoker invoker = new CommandInvoker();
        ProcessPaymentCommand first = command(gateway, "10.00");
        ProcessPaymentCommand second = command(gateway, "11.00");
        invoker.execute(first);
        invoker.execute(second);

        CommandResult undone = invoker.undoLast();

        assertThat(undone.getPayment().getId()).isEqualTo(second.getPayment().getId());
        assertThat(first.getPayment().getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(invoker.undoLast().getErrorCode()).isEqualTo(ErrorCode.NO_COMMAND_TO_UNDO);
    }

    @Test
    void failedUndoKeepsCommandForExplicitRetry() {
        PaymentGateway gateway = new SimulatedPaymentGateway(new FixedOutcomePolicy(true, false), clock, 0);
        CommandInvoker invoker = new CommandInvoker();
        ProcessPaymentCommand command = command(gateway, "10.00");
        invoker.execute(command);

        CommandResult result = invoker.undoLast();

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.REFUND_FAILED);
        assertThat(invoker.getLastExecuted()).containsSame(command);
    }

    @Test
    void unexpectedExceptionBecomesInternalError() {
        PaymentGateway gateway = mock(PaymentGateway.class);
        when(gateway.charge(any(), anyString(), anyString())).thenThrow(new IllegalStateException("socket closed"));
        CommandInvoker invoker = new CommandInvoker();

        CommandResult result = invoker.execute(command(gateway, "10.00"));

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INTERNAL);
        assertThat(result.getError().getMessage()).contains("socket closed");
        assertThat(result.getPayment().getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(invoker.undoLast().getErrorCode()).isEqualTo(ErrorCode.COMMAND_NOT_SUCCESSFUL);
    }

    @Test
    void chargeThenUndoRefundsOriginalReference() {
        PaymentGateway gateway = spy(new SimulatedPaymentGateway(FixedOutcomePolicy.alwaysSucceed(), clock, 0));
        CommandInvoker invoker = new CommandInvoker();

        CommandResult charged = invoker.execute(command(gateway, "99.99"));
        String reference = charged.getPayment().getTransactionReference();
        CommandResult refunded = invoker.undoLast();

        assertThat(charged.getPayment().getAmount()).isEqualByComparingTo("99.99");
        assertThat(refunded.isSuccess()).isTrue();
        assertThat(refunded.getPayment().getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        verify(gateway, times(1)).refund(reference);
        verify(gateway, times(1)).refund(anyString());
    }
}

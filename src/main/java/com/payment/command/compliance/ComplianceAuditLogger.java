package com.payment.command.compliance;

import com.payment.command.core.CommandResult;
import com.payment.command.core.CommandType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one {@code [AUDIT]} line for every executed and every undone command. The lines go
 * through the regular logging pipeline, so an appender or log shipper can route them to a
 * dedicated audit store.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logExecuted(CommandType commandType, String subjectId, CommandResult result) {
        log.info("[AUDIT] COMMAND_EXECUTED type={} subject={} paymentId={} status={} transactionReference={} errorCode={}",
                commandType,
                subjectId,
                result.hasPayment() ? result.getPayment().getId() : null,
                result.hasPayment() ? result.getPayment().getStatus() : null,
                result.hasPayment() ? result.getPayment().getTransactionReference() : null,
                result.getErrorCode());
    }

    public void logUndone(String paymentId, CommandResult result) {
        log.info("[AUDIT] COMMAND_UNDONE paymentId={} status={} errorCode={}",
                paymentId,
                result.hasPayment() ? result.getPayment().getStatus() : null,
                result.getErrorCode());
    }
}

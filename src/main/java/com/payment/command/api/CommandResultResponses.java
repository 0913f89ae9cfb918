package com.payment.command.api;

import com.payment.command.core.CommandResult;
import com.payment.command.core.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps command results to HTTP responses. Results carrying a payment answer with the payment
 * and its error; results without one answer with the {@code {error, message}} body used by
 * {@link GlobalExceptionHandler}.
 */
final class CommandResultResponses {

    private CommandResultResponses() {
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case INVALID_ARGUMENT:
                return HttpStatus.BAD_REQUEST;
            case GATEWAY_DECLINED:
                return HttpStatus.OK;
            case NO_COMMAND_TO_UNDO:
            case COMMAND_NOT_SUCCESSFUL:
            case SUBSCRIPTION_NOT_ACTIVE:
            case SUBSCRIPTION_NOT_DUE:
            case SUBSCRIPTION_BUSY:
                return HttpStatus.CONFLICT;
            case INVALID_REFERENCE:
            case REFUND_FAILED:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    /**
     * @param okStatus status for a successful result and for a declined charge
     */
    static ResponseEntity<Object> toResponse(CommandResult result, HttpStatus okStatus) {
        HttpStatus status = result.isSuccess() || result.getErrorCode() == ErrorCode.GATEWAY_DECLINED
                ? okStatus
                : statusFor(result.getErrorCode());
        if (result.hasPayment()) {
            return ResponseEntity.status(status).body(PaymentResponseDto.from(result));
        }
        return ResponseEntity.status(status).body(Map.of(
                "error", result.getErrorCode().name(),
                "message", result.getError().getMessage() != null ? result.getError().getMessage() : ""));
    }
}

package com.payment.command.api;

import com.payment.command.core.CommandResult;
import com.payment.command.core.PaymentCommandService;
import com.payment.command.domain.PaymentStatus;
import com.payment.command.scheduler.RecurringPaymentScheduler;
import com.payment.command.scheduler.RecurringScanReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for one-off payments, refunds and manual recurring scans.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Process, refund and query payments")
public class PaymentController {

    private final PaymentCommandService paymentCommandService;
    private final RecurringPaymentScheduler recurringPaymentScheduler;
    private final Clock clock;

    @PostMapping("/process")
    @Operation(
            summary = "Process payment",
            description = "Charge a customer once through a ProcessPaymentCommand. Every accepted request creates a payment: "
                    + "201 with status COMPLETED on approval, 201 with status FAILED and errorCode=GATEWAY_DECLINED on decline.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Payment created. Check body.status: COMPLETED or FAILED (with errorCode/message).",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid amount, currency or customer. Body: { \"error\": \"INVALID_ARGUMENT\"|\"VALIDATION_FAILED\", ... }"),
            @ApiResponse(responseCode = "500", description = "Internal error. Body: { \"error\": \"INTERNAL\"|\"INTERNAL_ERROR\", \"message\": \"...\" }")
    })
    public ResponseEntity<Object> process(@Valid @RequestBody ProcessPaymentRequestDto dto) {
        CommandResult result = paymentCommandService.executeProcessPayment(dto.getAmount(), dto.getCurrency(), dto.getCustomerRef());
        log.debug("Process payment finished: customerRef={}, errorCode={}", dto.getCustomerRef(), result.getErrorCode());
        return CommandResultResponses.toResponse(result, HttpStatus.CREATED);
    }

    @PostMapping("/{id}/refund")
    @Operation(
            summary = "Refund payment",
            description = "Undo the command that produced the payment. Each completed payment can be refunded once.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment refunded; body.status is REFUNDED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentResponseDto.class))),
            @ApiResponse(responseCode = "404", description = "Unknown payment id."),
            @ApiResponse(responseCode = "409", description = "Nothing to undo (NO_COMMAND_TO_UNDO) or the payment never completed (COMMAND_NOT_SUCCESSFUL)."),
            @ApiResponse(responseCode = "502", description = "Gateway rejected the refund (INVALID_REFERENCE or REFUND_FAILED); the payment stays COMPLETED.")
    })
    public ResponseEntity<Object> refund(@PathVariable("id") String paymentId) {
        CommandResult result = paymentCommandService.executeRefund(paymentId);
        return CommandResultResponses.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/process-recurring")
    @Operation(
            summary = "Process due subscriptions",
            description = "Run one recurring scan now and report every payment it produced and every subscription that failed.")
    public ResponseEntity<RecurringScanResponseDto> processRecurring() {
        RecurringScanReport report = recurringPaymentScheduler.scan(clock.instant());
        return ResponseEntity.ok(RecurringScanResponseDto.from(report));
    }

    @GetMapping
    @Operation(summary = "List payments", description = "Newest first, optionally filtered by status and customer.")
    public ResponseEntity<List<PaymentResponseDto>> list(@RequestParam(value = "status", required = false) PaymentStatus status,
                                                         @RequestParam(value = "customerRef", required = false) String customerRef) {
        List<PaymentResponseDto> payments = paymentCommandService.listPayments(status, customerRef).stream()
                .map(PaymentResponseDto::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(payments);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get payment")
    public ResponseEntity<PaymentResponseDto> get(@PathVariable("id") String paymentId) {
        return ResponseEntity.ok(PaymentResponseDto.from(paymentCommandService.getPayment(paymentId)));
    }
}

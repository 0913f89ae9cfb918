package com.payment.command.api;

import com.payment.command.scheduler.RecurringScanReport;
import com.payment.command.scheduler.SubscriptionFailure;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API response for a manually triggered recurring scan.
 */
@Value
@Builder
public class RecurringScanResponseDto {

    Instant scannedAt;
    int dueCount;
    int processedCount;
    int skippedInFlight;
    List<PaymentResponseDto> payments;
    List<FailureDto> failures;

    @Value
    @Builder
    public static class FailureDto {
        String subscriptionId;
        String errorCode;
        String message;
        String paymentId;

        static FailureDto from(SubscriptionFailure failure) {
            return FailureDto.builder()
                    .subscriptionId(failure.getSubscriptionId())
                    .errorCode(failure.getError().getCode().name())
                    .message(failure.getError().getMessage())
                    .paymentId(failure.getPayment() != null ? failure.getPayment().getId() : null)
                    .build();
        }
    }

    public static RecurringScanResponseDto from(RecurringScanReport report) {
        return RecurringScanResponseDto.builder()
                .scannedAt(report.getScannedAt())
                .dueCount(report.getDueCount())
                .processedCount(report.getPayments().size())
                .skippedInFlight(report.getSkippedInFlight())
                .payments(report.getPayments().stream().map(PaymentResponseDto::from).collect(Collectors.toList()))
                .failures(report.getFailures().stream().map(FailureDto::from).collect(Collectors.toList()))
                .build();
    }
}

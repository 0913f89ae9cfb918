package com.payment.command.api;

import com.payment.command.core.CommandResult;
import com.payment.command.core.SubscriptionService;
import com.payment.command.domain.Subscription;
import com.payment.command.domain.SubscriptionStatus;
import com.payment.command.scheduler.RecurringPaymentScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for subscriptions: creation, status changes and manual charging.
 */
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Manage recurring billing agreements")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final RecurringPaymentScheduler recurringPaymentScheduler;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Create subscription", description = "Creates an ACTIVE subscription. "
            + "Defaults: currency USD, interval MONTHLY, nextPaymentDate now.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Subscription created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = SubscriptionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid amount, currency or customer.")
    })
    public ResponseEntity<SubscriptionResponseDto> create(@Valid @RequestBody SubscriptionRequestDto dto) {
        Subscription subscription = subscriptionService.createSubscription(dto.getAmount(), dto.getCurrency(),
                dto.getCustomerRef(), dto.getInterval(), dto.getNextPaymentDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionResponseDto.from(subscription, 0));
    }

    @GetMapping
    @Operation(summary = "List subscriptions", description = "Newest first, optionally filtered by status and customer.")
    public ResponseEntity<List<SubscriptionResponseDto>> list(@RequestParam(value = "status", required = false) SubscriptionStatus status,
                                                              @RequestParam(value = "customerRef", required = false) String customerRef) {
        List<SubscriptionResponseDto> subscriptions = subscriptionService.listSubscriptions(status, customerRef).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(subscriptions);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get subscription")
    public ResponseEntity<SubscriptionResponseDto> get(@PathVariable("id") String subscriptionId) {
        return ResponseEntity.ok(toDto(subscriptionService.getSubscription(subscriptionId)));
    }

    @PostMapping("/{id}/pause")
    @Operation(summary = "Pause subscription", description = "ACTIVE -> PAUSED. 409 ILLEGAL_TRANSITION otherwise.")
    public ResponseEntity<SubscriptionResponseDto> pause(@PathVariable("id") String subscriptionId) {
        return ResponseEntity.ok(toDto(subscriptionService.pause(subscriptionId)));
    }

    @PostMapping("/{id}/resume")
    @Operation(summary = "Resume subscription", description = "PAUSED -> ACTIVE. 409 ILLEGAL_TRANSITION otherwise.")
    public ResponseEntity<SubscriptionResponseDto> resume(@PathVariable("id") String subscriptionId) {
        return ResponseEntity.ok(toDto(subscriptionService.resume(subscriptionId)));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel subscription", description = "ACTIVE or PAUSED -> CANCELLED, which is final.")
    public ResponseEntity<SubscriptionResponseDto> cancel(@PathVariable("id") String subscriptionId) {
        return ResponseEntity.ok(toDto(subscriptionService.cancel(subscriptionId)));
    }

    @PostMapping("/{id}/process")
    @Operation(summary = "Charge subscription now",
            description = "Charges the installment if the subscription is ACTIVE and due. "
                    + "200 with the payment (COMPLETED, or FAILED with errorCode=GATEWAY_DECLINED); "
                    + "409 SUBSCRIPTION_NOT_ACTIVE, SUBSCRIPTION_NOT_DUE or SUBSCRIPTION_BUSY otherwise.")
    public ResponseEntity<Object> process(@PathVariable("id") String subscriptionId) {
        CommandResult result = recurringPaymentScheduler.processSubscription(subscriptionId, clock.instant());
        return CommandResultResponses.toResponse(result, HttpStatus.OK);
    }

    private SubscriptionResponseDto toDto(Subscription subscription) {
        return SubscriptionResponseDto.from(subscription, subscriptionService.countPayments(subscription.getId()));
    }
}

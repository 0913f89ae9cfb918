package com.payment.command.persistence.service;

import com.payment.command.domain.Payment;
import com.payment.command.domain.PaymentStatus;
import com.payment.command.persistence.entity.PaymentEntity;
import com.payment.command.persistence.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stores payments produced by commands. Failures propagate to the caller, which decides
 * how to report a payment that reached the gateway but could not be recorded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    /**
     * Persists a payment (creates or updates by id).
     */
    @Transactional
    public void save(Payment payment) {
        Optional<PaymentEntity> existingOpt = paymentRepository.findById(payment.getId());

        PaymentEntity entity;
        if (existingOpt.isPresent()) {
            entity = existingOpt.get();
            entity.setStatus(payment.getStatus());
            entity.setTransactionReference(payment.getTransactionReference());
            entity.setProcessedAt(payment.getProcessedAt());
        } else {
            entity = PaymentEntity.builder()
                    .id(payment.getId())
                    .amount(payment.getAmount())
                    .currency(payment.getCurrency())
                    .status(payment.getStatus())
                    .transactionReference(payment.getTransactionReference())
                    .customerRef(payment.getCustomerRef())
                    .subscriptionId(payment.getSubscriptionId())
                    .createdAt(payment.getCreatedAt())
                    .processedAt(payment.getProcessedAt())
                    .build();
        }

        paymentRepository.save(entity);
        log.debug("Persisted payment: paymentId={}, status={}", payment.getId(), payment.getStatus());
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(String paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentPersistenceService::toDomain);
    }

    /**
     * Lists payments newest first, optionally narrowed by status and/or customer.
     */
    @Transactional(readOnly = true)
    public List<Payment> list(PaymentStatus status, String customerRef) {
        List<PaymentEntity> entities;
        if (status != null && customerRef != null) {
            entities = paymentRepository.findByStatusAndCustomerRefOrderByCreatedAtDesc(status, customerRef);
        } else if (status != null) {
            entities = paymentRepository.findByStatusOrderByCreatedAtDesc(status);
        } else if (customerRef != null) {
            entities = paymentRepository.findByCustomerRefOrderByCreatedAtDesc(customerRef);
        } else {
            entities = paymentRepository.findAllByOrderByCreatedAtDesc();
        }
        return entities.stream().map(PaymentPersistenceService::toDomain).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long countBySubscription(String subscriptionId) {
        return paymentRepository.countBySubscriptionId(subscriptionId);
    }

    static Payment toDomain(PaymentEntity entity) {
        return Payment.builder()
                .id(entity.getId())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .customerRef(entity.getCustomerRef())
                .subscriptionId(entity.getSubscriptionId())
                .createdAt(entity.getCreatedAt())
                .status(entity.getStatus())
                .transactionReference(entity.getTransactionReference())
                .processedAt(entity.getProcessedAt())
                .build();
    }
}

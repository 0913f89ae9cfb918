package com.payment.command.persistence.service;

import com.payment.command.domain.Payment;
import com.payment.command.domain.Subscription;
import com.payment.command.domain.SubscriptionStatus;
import com.payment.command.persistence.entity.SubscriptionEntity;
import com.payment.command.persistence.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stores subscriptions and records charged installments together with the advanced due date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionPersistenceService {

    private final SubscriptionRepository subscriptionRepository;
    private final PaymentPersistenceService paymentPersistenceService;

    @Transactional
    public void save(Subscription subscription) {
        Optional<SubscriptionEntity> existingOpt = subscriptionRepository.findById(subscription.getId());

        SubscriptionEntity entity;
        if (existingOpt.isPresent()) {
            entity = existingOpt.get();
            entity.setStatus(subscription.getStatus());
            entity.setNextPaymentDate(subscription.getNextPaymentDate());
        } else {
            entity = SubscriptionEntity.builder()
                    .id(subscription.getId())
                    .amount(subscription.getAmount())
                    .currency(subscription.getCurrency())
                    .customerRef(subscription.getCustomerRef())
                    .interval(subscription.getInterval())
                    .status(subscription.getStatus())
                    .nextPaymentDate(subscription.getNextPaymentDate())
                    .createdAt(subscription.getCreatedAt())
                    .build();
        }

        subscriptionRepository.save(entity);
        log.debug("Persisted subscription: subscriptionId={}, status={}, nextPaymentDate={}",
                subscription.getId(), subscription.getStatus(), subscription.getNextPaymentDate());
    }

    /**
     * Stores an installment's payment and the subscription's advanced due date in one
     * transaction, so a stored installment never leaves the old due date behind.
     */
    @Transactional
    public void recordRecurringCharge(Payment payment, Subscription subscription) {
        paymentPersistenceService.save(payment);
        save(subscription);
    }

    @Transactional(readOnly = true)
    public Optional<Subscription> findById(String subscriptionId) {
        return subscriptionRepository.findById(subscriptionId).map(SubscriptionPersistenceService::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Subscription> findDue(Instant now) {
        return subscriptionRepository.findDue(SubscriptionStatus.ACTIVE, now).stream()
                .map(SubscriptionPersistenceService::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<Subscription> list(SubscriptionStatus status, String customerRef) {
        List<SubscriptionEntity> entities;
        if (status != null && customerRef != null) {
            entities = subscriptionRepository.findByStatusAndCustomerRefOrderByCreatedAtDesc(status, customerRef);
        } else if (status != null) {
            entities = subscriptionRepository.findByStatusOrderByCreatedAtDesc(status);
        } else if (customerRef != null) {
            entities = subscriptionRepository.findByCustomerRefOrderByCreatedAtDesc(customerRef);
        } else {
            entities = subscriptionRepository.findAllByOrderByCreatedAtDesc();
        }
        return entities.stream().map(SubscriptionPersistenceService::toDomain).collect(Collectors.toList());
    }

    static Subscription toDomain(SubscriptionEntity entity) {
        return Subscription.builder()
                .id(entity.getId())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .customerRef(entity.getCustomerRef())
                .interval(entity.getInterval())
                .createdAt(entity.getCreatedAt())
                .status(entity.getStatus())
                .nextPaymentDate(entity.getNextPaymentDate())
                .build();
    }
}

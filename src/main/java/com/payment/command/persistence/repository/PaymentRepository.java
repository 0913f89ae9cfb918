package com.payment.command.persistence.repository;

import com.payment.command.domain.PaymentStatus;
import com.payment.command.persistence.entity.PaymentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for payments. Listings are newest first.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    List<PaymentEntity> findAllByOrderByCreatedAtDesc();

    List<PaymentEntity> findByStatusOrderByCreatedAtDesc(PaymentStatus status);

    List<PaymentEntity> findByCustomerRefOrderByCreatedAtDesc(String customerRef);

    List<PaymentEntity> findByStatusAndCustomerRefOrderByCreatedAtDesc(PaymentStatus status, String customerRef);

    long countBySubscriptionId(String subscriptionId);
}

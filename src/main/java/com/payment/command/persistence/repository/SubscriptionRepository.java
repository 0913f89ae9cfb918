package com.payment.command.persistence.repository;

import com.payment.command.domain.SubscriptionStatus;
import com.payment.command.persistence.entity.SubscriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, String> {

    /**
     * Subscriptions in the given status whose next payment date is at or before the threshold,
     * oldest due date first.
     */
    @Query("SELECT s FROM SubscriptionEntity s WHERE s.status = :status AND s.nextPaymentDate <= :threshold "
            + "ORDER BY s.nextPaymentDate ASC, s.id ASC")
    List<SubscriptionEntity> findDue(@Param("status") SubscriptionStatus status, @Param("threshold") Instant threshold);

    List<SubscriptionEntity> findAllByOrderByCreatedAtDesc();

    List<SubscriptionEntity> findByStatusOrderByCreatedAtDesc(SubscriptionStatus status);

    List<SubscriptionEntity> findByCustomerRefOrderByCreatedAtDesc(String customerRef);

    List<SubscriptionEntity> findByStatusAndCustomerRefOrderByCreatedAtDesc(SubscriptionStatus status, String customerRef);
}

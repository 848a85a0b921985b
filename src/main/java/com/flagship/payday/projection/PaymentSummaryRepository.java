package com.flagship.payday.projection;

import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.payment.SettlementMethod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentSummaryRepository extends JpaRepository<PaymentSummaryEntity, UUID> {

    /**
     * Invoices still waiting for payment whose expiry passed.
     */
    List<PaymentSummaryEntity> findByStatusAndExpiresAtBefore(PaymentStatus status, Instant cutoff);

    /**
     * Payments stuck in a status since before {@code cutoff}.
     */
    List<PaymentSummaryEntity> findByStatusAndMethodAndUpdatedAtBefore(PaymentStatus status,
                                                                      SettlementMethod method,
                                                                      Instant cutoff);

    long countByStatus(PaymentStatus status);
}

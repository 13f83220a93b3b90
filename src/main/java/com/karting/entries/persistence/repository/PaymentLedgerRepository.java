package com.karting.entries.persistence.repository;

import com.karting.entries.persistence.entity.PaymentLedgerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PaymentLedgerRepository extends JpaRepository<PaymentLedgerEntity, String> {

    boolean existsByPfPaymentIdAndPaymentStatus(String pfPaymentId, String paymentStatus);

    List<PaymentLedgerEntity> findByPaymentReferenceOrderByCreatedAtAsc(String paymentReference);

    long countByPfPaymentId(String pfPaymentId);
}

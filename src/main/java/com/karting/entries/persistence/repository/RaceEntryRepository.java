package com.karting.entries.persistence.repository;

import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Race entries. State transitions go through the conditional updates below so that
 * concurrent webhook retries, admin actions and expiry runs are serialised by the database.
 */
@Repository
public interface RaceEntryRepository extends JpaRepository<RaceEntryEntity, String> {

    Optional<RaceEntryEntity> findByDriverIdAndEventIdAndPaymentReference(
            String driverId, String eventId, String paymentReference);

    List<RaceEntryEntity> findByPaymentReference(String paymentReference);

    Optional<RaceEntryEntity> findByRequestKey(String requestKey);

    List<RaceEntryEntity> findByDriverIdOrderByCreatedAtDesc(String driverId);

    List<RaceEntryEntity> findByEventIdOrderByCreatedAtAsc(String eventId);

    List<RaceEntryEntity> findAllByOrderByCreatedAtDesc();

    List<RaceEntryEntity> findByPaymentStatusAndCreatedAtBefore(PaymentStatus paymentStatus, Instant cutoff);

    /**
     * Pending to Completed compare-and-set. Returns the number of rows moved; zero means the
     * row is absent or already left Pending.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RaceEntryEntity e SET e.paymentStatus = :completed, e.entryStatus = :confirmed, "
            + "e.pfPaymentId = :pfPaymentId, e.amountPaid = COALESCE(:amount, e.amountPaid), "
            + "e.completedAt = :now, e.updatedAt = :now "
            + "WHERE e.paymentReference = :reference AND e.paymentStatus = :pending")
    int completePending(@Param("reference") String paymentReference,
                        @Param("pfPaymentId") String pfPaymentId,
                        @Param("amount") BigDecimal amount,
                        @Param("now") Instant now,
                        @Param("completed") PaymentStatus completed,
                        @Param("confirmed") EntryStatus confirmed,
                        @Param("pending") PaymentStatus pending);

    /** Cancelled to Completed for a payment that arrived after the entry was cancelled. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RaceEntryEntity e SET e.paymentStatus = :completed, e.entryStatus = :confirmed, "
            + "e.pfPaymentId = :pfPaymentId, e.amountPaid = COALESCE(:amount, e.amountPaid), "
            + "e.completedAt = :now, e.updatedAt = :now "
            + "WHERE e.paymentReference = :reference AND e.entryStatus = :cancelled")
    int completeCancelled(@Param("reference") String paymentReference,
                          @Param("pfPaymentId") String pfPaymentId,
                          @Param("amount") BigDecimal amount,
                          @Param("now") Instant now,
                          @Param("completed") PaymentStatus completed,
                          @Param("confirmed") EntryStatus confirmed,
                          @Param("cancelled") EntryStatus cancelled);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RaceEntryEntity e SET e.pfPaymentId = :pfPaymentId, e.updatedAt = :now "
            + "WHERE e.paymentReference = :reference AND e.pfPaymentId = :previous")
    int replacePfPaymentId(@Param("reference") String paymentReference,
                           @Param("previous") String previousPfPaymentId,
                           @Param("pfPaymentId") String pfPaymentId,
                           @Param("now") Instant now);

    /** Cancels only when the row is still in the payment state the caller observed. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RaceEntryEntity e SET e.paymentStatus = :failed, e.entryStatus = :cancelled, e.updatedAt = :now "
            + "WHERE e.entryId = :entryId AND e.paymentStatus = :expected AND e.entryStatus <> :cancelled")
    int cancelIfStatus(@Param("entryId") String entryId,
                       @Param("expected") PaymentStatus expected,
                       @Param("now") Instant now,
                       @Param("failed") PaymentStatus failed,
                       @Param("cancelled") EntryStatus cancelled);
}

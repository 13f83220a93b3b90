package com.karting.entries.persistence.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.karting.entries.api.DuplicateEntryException;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.persistence.entity.AuditLogEntity;
import com.karting.entries.persistence.entity.FailedNotificationEntity;
import com.karting.entries.persistence.entity.PaymentLedgerEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.AuditLogRepository;
import com.karting.entries.persistence.repository.FailedNotificationRepository;
import com.karting.entries.persistence.repository.PaymentLedgerRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable writes for the entry lifecycle. Methods expect to run inside a transaction opened by
 * {@link StoreTransactions}; a uniqueness race surfaces as a DataIntegrityViolationException so
 * the retry re-reads and resolves it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryStore {

    private static final ObjectMapper AUDIT_MAPPER = new ObjectMapper();

    private final RaceEntryRepository entryRepository;
    private final PaymentLedgerRepository ledgerRepository;
    private final FailedNotificationRepository failedNotificationRepository;
    private final AuditLogRepository auditLogRepository;

    /**
     * Insert a Pending entry. If a row for the same (driver, event, reference) already exists it is
     * returned unchanged.
     */
    public StoreResult<RaceEntryEntity> createPendingEntry(RaceEntryEntity entry) {
        Optional<RaceEntryEntity> existing = entryRepository.findByDriverIdAndEventIdAndPaymentReference(
                entry.getDriverId(), entry.getEventId(), entry.getPaymentReference());
        if (existing.isPresent()) {
            log.info("Pending entry already exists: entryId={}, paymentReference={}",
                    existing.get().getEntryId(), entry.getPaymentReference());
            return StoreResult.existing(existing.get());
        }
        entry.setPaymentStatus(PaymentStatus.PENDING);
        entry.setEntryStatus(EntryStatus.PENDING_PAYMENT);
        return StoreResult.created(entryRepository.saveAndFlush(entry));
    }

    /**
     * Pending to Completed compare-and-set keyed by payment reference. Returns the row as it was
     * before the transition, or empty when no Pending row was moved.
     */
    public Optional<RaceEntryEntity> completeEntry(String paymentReference, String pfPaymentId, BigDecimal amount) {
        Optional<RaceEntryEntity> prior = entryRepository.findByPaymentReference(paymentReference).stream()
                .filter(e -> e.getPaymentStatus() == PaymentStatus.PENDING)
                .findFirst()
                .map(e -> e.toBuilder().build());
        if (prior.isEmpty()) {
            return Optional.empty();
        }
        int updated = entryRepository.completePending(paymentReference, pfPaymentId, amount, Instant.now(),
                PaymentStatus.COMPLETED, EntryStatus.CONFIRMED, PaymentStatus.PENDING);
        if (updated == 0) {
            log.info("Pending entry moved concurrently, nothing to complete: paymentReference={}", paymentReference);
            return Optional.empty();
        }
        return prior;
    }

    /**
     * Confirms a cancelled entry whose payment arrived anyway. Returns the row as it was before,
     * or empty when no cancelled row carries the reference.
     */
    public Optional<RaceEntryEntity> completeCancelledEntry(String paymentReference, String pfPaymentId, BigDecimal amount) {
        Optional<RaceEntryEntity> prior = entryRepository.findByPaymentReference(paymentReference).stream()
                .filter(e -> e.getEntryStatus() == EntryStatus.CANCELLED)
                .findFirst()
                .map(e -> e.toBuilder().build());
        if (prior.isEmpty()) {
            return Optional.empty();
        }
        int updated = entryRepository.completeCancelled(paymentReference, pfPaymentId, amount, Instant.now(),
                PaymentStatus.COMPLETED, EntryStatus.CONFIRMED, EntryStatus.CANCELLED);
        return updated == 0 ? Optional.empty() : prior;
    }

    /** Swaps a placeholder gateway id for the real one; false when the row no longer carries it. */
    public boolean replacePfPaymentId(String paymentReference, String previousPfPaymentId, String pfPaymentId) {
        return entryRepository.replacePfPaymentId(paymentReference, previousPfPaymentId, pfPaymentId, Instant.now()) > 0;
    }

    /**
     * Insert an entry directly in its terminal state (Completed or Free).
     *
     * @throws DuplicateEntryException when a row for the same (driver, event, reference) exists
     */
    public RaceEntryEntity insertCompletedEntry(RaceEntryEntity entry) {
        if (entry.getPaymentStatus() == PaymentStatus.PENDING) {
            throw new IllegalArgumentException("insertCompletedEntry requires a terminal payment status");
        }
        if (entryRepository.findByDriverIdAndEventIdAndPaymentReference(
                entry.getDriverId(), entry.getEventId(), entry.getPaymentReference()).isPresent()) {
            throw new DuplicateEntryException(entry.getPaymentReference(),
                    "Entry already exists for reference " + entry.getPaymentReference());
        }
        entry.setEntryStatus(EntryStatus.CONFIRMED);
        if (entry.getCompletedAt() == null) {
            entry.setCompletedAt(Instant.now());
        }
        return entryRepository.saveAndFlush(entry);
    }

    /** Returns false when the same (pf_payment_id, status) was already recorded. */
    public boolean recordPaymentLedger(PaymentLedgerEntity row) {
        if (ledgerRepository.existsByPfPaymentIdAndPaymentStatus(row.getPfPaymentId(), row.getPaymentStatus())) {
            log.info("Ledger row already recorded: pfPaymentId={}, status={}", row.getPfPaymentId(), row.getPaymentStatus());
            return false;
        }
        if (row.getLedgerId() == null) {
            row.setLedgerId(UUID.randomUUID().toString());
        }
        ledgerRepository.saveAndFlush(row);
        return true;
    }

    public FailedNotificationEntity appendFailedNotification(String paymentReference, String errorSummary,
                                                             String payload, String headers) {
        FailedNotificationEntity record = FailedNotificationEntity.builder()
                .notificationId(UUID.randomUUID().toString())
                .occurredAt(Instant.now())
                .paymentReference(paymentReference)
                .errorSummary(truncate(errorSummary, 1000))
                .payload(payload == null ? "" : payload)
                .headers(headers)
                .build();
        return failedNotificationRepository.save(record);
    }

    public AuditLogEntity appendAudit(String action, String actor, String targetId, Map<String, ?> detail) {
        AuditLogEntity record = AuditLogEntity.builder()
                .auditId(UUID.randomUUID().toString())
                .occurredAt(Instant.now())
                .action(action)
                .actor(actor)
                .targetId(targetId)
                .detail(toJson(detail))
                .build();
        return auditLogRepository.save(record);
    }

    static String toJson(Map<String, ?> detail) {
        if (detail == null || detail.isEmpty()) {
            return "{}";
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        detail.forEach((k, v) -> copy.put(k, v == null ? null : (v instanceof Number || v instanceof Boolean ? v : v.toString())));
        try {
            return AUDIT_MAPPER.writeValueAsString(copy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit detail is not serialisable", e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "unknown error";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}

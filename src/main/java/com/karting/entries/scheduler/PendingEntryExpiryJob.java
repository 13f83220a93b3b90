package com.karting.entries.scheduler;

import com.karting.entries.compliance.ComplianceAuditLogger;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cancels entries left Pending longer than {@code max-age}. Each row goes through the same
 * conditional update as an operator cancel, so an entry completed by a late webhook is skipped.
 * Off unless {@code karting.entries.pending-expiry.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "karting.entries.pending-expiry.enabled", havingValue = "true")
public class PendingEntryExpiryJob {

    static final String ACTOR = "expiry-job";

    private final RaceEntryRepository entryRepository;
    private final EntryStore entryStore;
    private final StoreTransactions transactions;
    private final ComplianceAuditLogger auditLogger;

    @Value("${karting.entries.pending-expiry.max-age:PT24H}")
    private Duration maxAge;

    @Scheduled(fixedDelayString = "${karting.entries.pending-expiry.interval-ms:900000}",
            initialDelayString = "${karting.entries.pending-expiry.initial-delay-ms:60000}")
    public void expireStalePendingEntries() {
        expireOlderThan(Instant.now().minus(maxAge));
    }

    /** Returns the number of entries cancelled. */
    public int expireOlderThan(Instant cutoff) {
        List<RaceEntryEntity> stale = entryRepository.findByPaymentStatusAndCreatedAtBefore(PaymentStatus.PENDING, cutoff);
        int expired = 0;
        for (RaceEntryEntity entry : stale) {
            try {
                boolean cancelled = transactions.execute("expire_pending_entry", () -> {
                    int updated = entryRepository.cancelIfStatus(entry.getEntryId(), PaymentStatus.PENDING, Instant.now(),
                            PaymentStatus.FAILED, EntryStatus.CANCELLED);
                    if (updated == 1) {
                        entryStore.appendAudit("entry_expired", ACTOR, entry.getEntryId(), Map.of(
                                "paymentReference", entry.getPaymentReference(),
                                "createdAt", entry.getCreatedAt().toString()));
                    }
                    return updated == 1;
                });
                if (cancelled) {
                    expired++;
                    auditLogger.logTransition(entry.getEntryId(), entry.getPaymentReference(),
                            PaymentStatus.PENDING, PaymentStatus.FAILED, ACTOR);
                }
            } catch (RuntimeException e) {
                log.error("Could not expire pending entry: entryId={}, paymentReference={}",
                        entry.getEntryId(), entry.getPaymentReference(), e);
            }
        }
        if (!stale.isEmpty()) {
            log.info("Pending entry expiry: candidates={}, expired={}, cutoff={}", stale.size(), expired, cutoff);
        }
        return expired;
    }
}

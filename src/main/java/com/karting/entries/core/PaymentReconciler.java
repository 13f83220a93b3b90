package com.karting.entries.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.karting.entries.api.ValidationFailedException;
import com.karting.entries.compliance.ComplianceAuditLogger;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.GatewayPaymentStatus;
import com.karting.entries.domain.PaymentReference;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.domain.WebhookNotification;
import com.karting.entries.mail.EntryNotifications;
import com.karting.entries.messaging.EntryEventProducer;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.PaymentLedgerEntity;
import com.karting.entries.persistence.entity.PoolEngineRentalEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.EventRepository;
import com.karting.entries.persistence.repository.PoolEngineRentalRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Decides which entry or pool rental a confirmed payment belongs to. Used by the webhook and by
 * operators reconciling payments the gateway never notified.
 * <p>
 * Ledger row, state transition and audit row for one notification commit together. The ledger is
 * unique on (pf_payment_id, status), so a repeated delivery of the same COMPLETE notice stops
 * at the ledger and changes nothing else.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciler {

    static final String ACTOR_GATEWAY = "gateway";
    static final String MANUAL_PAYMENT_PREFIX = "MANUAL-";

    private static final ObjectMapper PAYLOAD_MAPPER = new ObjectMapper();

    private final EntryStore entryStore;
    private final StoreTransactions transactions;
    private final RaceEntryRepository entryRepository;
    private final PoolEngineRentalRepository poolRentalRepository;
    private final EventRepository eventRepository;
    private final DriverRepository driverRepository;
    private final EntryNotifications notifications;
    private final EntryEventProducer eventProducer;
    private final ComplianceAuditLogger auditLogger;

    /** Apply a notification whose signature the gateway adapter has already verified. */
    public ReconcileOutcome reconcileNotification(WebhookNotification notification) {
        auditLogger.logNotification(notification);
        return reconcile(notification, PaymentLedgerEntity.SOURCE_WEBHOOK, ACTOR_GATEWAY);
    }

    /**
     * Operator-driven equivalent of a COMPLETE webhook. Applying it twice, or before or after the
     * real webhook, leaves the same terminal state.
     */
    public ReconcileOutcome reconcileManually(AdminReconcileRequest request) {
        PaymentReference reference = PaymentReference.parse(request.getPaymentReference());
        if (reference.getKind() == PaymentReference.Kind.UNKNOWN) {
            throw new ValidationFailedException("paymentReference",
                    "Unrecognised payment reference " + request.getPaymentReference());
        }
        String pfPaymentId = request.getPfPaymentId() == null || request.getPfPaymentId().isBlank()
                ? MANUAL_PAYMENT_PREFIX + reference.getValue()
                : request.getPfPaymentId().trim();
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("m_payment_id", reference.getValue());
        raw.put("pf_payment_id", pfPaymentId);
        raw.put("payment_status", "COMPLETE");
        if (request.getAmount() != null) {
            raw.put("amount_gross", request.getAmount().toPlainString());
        }
        String actor = request.getActor() == null || request.getActor().isBlank() ? "admin" : request.getActor();
        raw.put("reconciled_by", actor);

        WebhookNotification notification = WebhookNotification.builder()
                .paymentReference(reference)
                .pfPaymentId(pfPaymentId)
                .amountGross(request.getAmount())
                .paymentStatus(GatewayPaymentStatus.COMPLETE)
                .rawPaymentStatus("COMPLETE")
                .payerEmail(request.getPayerEmail())
                .payerFirstName(request.getPayerFirstName())
                .payerLastName(request.getPayerLastName())
                .itemName("Manual reconciliation")
                .rawFields(raw)
                .build();
        return reconcile(notification, PaymentLedgerEntity.SOURCE_ADMIN, actor);
    }

    private ReconcileOutcome reconcile(WebhookNotification notification, String source, String actor) {
        if (notification.getPfPaymentId() == null) {
            throw new ValidationFailedException("pf_payment_id", "Notification carries no gateway payment id");
        }
        PaymentReference reference = notification.getPaymentReference();

        ReconcileOutcome outcome = transactions.execute("reconcile_payment", () -> {
            boolean firstSighting = entryStore.recordPaymentLedger(ledgerRow(notification, source));
            if (!firstSighting) {
                return outcome(ReconcileOutcome.Result.ALREADY_APPLIED, reference);
            }
            if (!notification.isComplete()) {
                log.info("Notification not complete, ledger only: paymentReference={}, status={}",
                        reference, notification.getRawPaymentStatus());
                return outcome(ReconcileOutcome.Result.NOT_COMPLETE, reference);
            }
            switch (reference.getKind()) {
                case RACE:
                    return applyRace((PaymentReference.Race) reference, notification, actor);
                case POOL:
                    return applyPool((PaymentReference.Pool) reference, notification, actor);
                default:
                    entryStore.appendFailedNotification(reference.getValue(),
                            "Unknown payment reference prefix", toJson(notification.getRawFields()), null);
                    log.warn("Payment with unknown reference recorded for review: paymentReference={}", reference);
                    return outcome(ReconcileOutcome.Result.UNKNOWN_REFERENCE, reference);
            }
        });

        afterCommit(outcome, actor);
        return outcome;
    }

    private ReconcileOutcome applyRace(PaymentReference.Race reference, WebhookNotification notification, String actor) {
        Optional<RaceEntryEntity> prior = entryStore.completeEntry(
                reference.getValue(), notification.getPfPaymentId(), notification.getAmountGross());
        if (prior.isPresent()) {
            return confirmed(reference, notification, actor, prior.get(), "entry_completed");
        }

        Optional<RaceEntryEntity> cancelled = entryStore.completeCancelledEntry(
                reference.getValue(), notification.getPfPaymentId(), notification.getAmountGross());
        if (cancelled.isPresent()) {
            log.warn("Payment arrived for cancelled entry, confirming it: paymentReference={}, entryId={}",
                    reference, cancelled.get().getEntryId());
            return confirmed(reference, notification, actor, cancelled.get(), "payment_after_cancel");
        }

        List<RaceEntryEntity> existing = entryRepository.findByPaymentReference(reference.getValue());
        if (!existing.isEmpty()) {
            RaceEntryEntity row = existing.get(0);
            if (isManualPlaceholder(row.getPfPaymentId(), notification.getPfPaymentId())
                    && entryStore.replacePfPaymentId(reference.getValue(), row.getPfPaymentId(), notification.getPfPaymentId())) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("paymentReference", reference.getValue());
                detail.put("previousPfPaymentId", row.getPfPaymentId());
                detail.put("pfPaymentId", notification.getPfPaymentId());
                entryStore.appendAudit("gateway_id_recorded", actor, row.getEntryId(), detail);
                row = entryRepository.findById(row.getEntryId()).orElse(row);
            }
            log.info("Entry already settled, nothing to apply: paymentReference={}, status={}",
                    reference, row.getPaymentStatus());
            return ReconcileOutcome.builder()
                    .result(ReconcileOutcome.Result.ALREADY_APPLIED)
                    .paymentReference(reference.getValue())
                    .entry(row)
                    .previousStatus(row.getPaymentStatus())
                    .build();
        }

        PaymentReference.RaceParties parties = resolveParties(reference);
        DriverEntity driver = driverRepository.findById(parties.getDriverId()).orElse(null);
        RaceEntryEntity late = RaceEntryEntity.builder()
                .entryId(UUID.randomUUID().toString())
                .driverId(parties.getDriverId())
                .eventId(parties.getEventId())
                .raceClass(driver != null ? driver.getChampionshipClass() : null)
                .entryItems(new ArrayList<>())
                .amountPaid(notification.getAmountGross() != null ? notification.getAmountGross() : BigDecimal.ZERO)
                .paymentReference(reference.getValue())
                .pfPaymentId(notification.getPfPaymentId())
                .paymentStatus(PaymentStatus.COMPLETED)
                .entryStatus(EntryStatus.CONFIRMED)
                .build();
        RaceEntryEntity saved = entryStore.insertCompletedEntry(late);
        if (driver != null) {
            driverRepository.updateNextRaceStatus(driver.getDriverId(), DriverEntity.STATUS_REGISTERED, DriverEntity.RENTAL_NONE);
        }
        Map<String, Object> detail = EntryCoordinator.auditDetail(saved);
        detail.put("pfPaymentId", notification.getPfPaymentId());
        detail.put("payerEmail", notification.getPayerEmail());
        detail.put("payerName", joinName(notification));
        detail.put("itemName", notification.getItemName());
        detail.put("knownDriver", driver != null);
        entryStore.appendAudit("late_webhook", actor, saved.getEntryId(), detail);
        log.warn("Late payment synthesised entry for operator review: paymentReference={}, entryId={}",
                reference, saved.getEntryId());
        return ReconcileOutcome.builder()
                .result(ReconcileOutcome.Result.LATE_ENTRY_CREATED)
                .paymentReference(reference.getValue())
                .entry(saved)
                .build();
    }

    private ReconcileOutcome confirmed(PaymentReference.Race reference, WebhookNotification notification, String actor,
                                       RaceEntryEntity prior, String action) {
        RaceEntryEntity completed = entryRepository.findById(prior.getEntryId()).orElseThrow();
        driverRepository.updateNextRaceStatus(completed.getDriverId(), DriverEntity.STATUS_REGISTERED,
                completed.hasItem(EntryItem.ENGINE)
                        ? DriverEntity.RENTAL_BOOKED : DriverEntity.RENTAL_NONE);
        Map<String, Object> detail = EntryCoordinator.auditDetail(completed);
        detail.put("pfPaymentId", notification.getPfPaymentId());
        detail.put("previousStatus", prior.getPaymentStatus());
        entryStore.appendAudit(action, actor, completed.getEntryId(), detail);
        return ReconcileOutcome.builder()
                .result(ReconcileOutcome.Result.ENTRY_COMPLETED)
                .paymentReference(reference.getValue())
                .entry(completed)
                .previousStatus(prior.getPaymentStatus())
                .build();
    }

    /** A manual reconciliation without a gateway id leaves a placeholder the real notification replaces. */
    static boolean isManualPlaceholder(String current, String incoming) {
        return current != null && current.startsWith(MANUAL_PAYMENT_PREFIX)
                && incoming != null && !incoming.startsWith(MANUAL_PAYMENT_PREFIX);
    }

    private ReconcileOutcome applyPool(PaymentReference.Pool reference, WebhookNotification notification, String actor) {
        int seasonYear = Instant.ofEpochMilli(reference.getEpochMillis()).atZone(ZoneOffset.UTC).getYear();
        PoolEngineRentalEntity rental = poolRentalRepository.findByPaymentReference(reference.getValue())
                .or(() -> poolRentalRepository.findByDriverIdAndSeasonYear(reference.getDriverId(), seasonYear).stream()
                        .filter(r -> PaymentReference.toTag(r.getChampionshipClass()).equals(reference.getClassTag())
                                && PaymentReference.toTag(r.getRentalType()).equals(reference.getRentalType()))
                        .findFirst())
                .orElse(null);

        if (rental != null && rental.getPaymentStatus() == PaymentStatus.COMPLETED) {
            if (isManualPlaceholder(rental.getPfPaymentId(), notification.getPfPaymentId())) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("paymentReference", rental.getPaymentReference());
                detail.put("previousPfPaymentId", rental.getPfPaymentId());
                detail.put("pfPaymentId", notification.getPfPaymentId());
                rental.setPfPaymentId(notification.getPfPaymentId());
                rental = poolRentalRepository.saveAndFlush(rental);
                entryStore.appendAudit("gateway_id_recorded", actor, rental.getRentalId(), detail);
            }
            log.info("Pool rental already paid: paymentReference={}, rentalId={}", reference, rental.getRentalId());
            return ReconcileOutcome.builder()
                    .result(ReconcileOutcome.Result.ALREADY_APPLIED)
                    .paymentReference(reference.getValue())
                    .poolRental(rental)
                    .build();
        }
        if (rental == null) {
            rental = PoolEngineRentalEntity.builder()
                    .rentalId(UUID.randomUUID().toString())
                    .driverId(reference.getDriverId())
                    .championshipClass(reference.getClassTag())
                    .rentalType(reference.getRentalType())
                    .seasonYear(seasonYear)
                    .build();
        }
        PaymentStatus previous = rental.getPaymentStatus();
        rental.setPaymentReference(reference.getValue());
        rental.setPfPaymentId(notification.getPfPaymentId());
        if (notification.getAmountGross() != null || rental.getAmountPaid() == null) {
            rental.setAmountPaid(notification.getAmountGross() != null ? notification.getAmountGross() : BigDecimal.ZERO);
        }
        rental.setPaymentStatus(PaymentStatus.COMPLETED);
        rental.setCompletedAt(Instant.now());
        PoolEngineRentalEntity saved = poolRentalRepository.saveAndFlush(rental);
        driverRepository.markSeasonEngineRental(saved.getDriverId());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("paymentReference", saved.getPaymentReference());
        detail.put("pfPaymentId", notification.getPfPaymentId());
        detail.put("championshipClass", saved.getChampionshipClass());
        detail.put("rentalType", saved.getRentalType());
        detail.put("seasonYear", saved.getSeasonYear());
        detail.put("amount", saved.getAmountPaid());
        detail.put("previousStatus", previous);
        entryStore.appendAudit("pool_rental_completed", actor, saved.getRentalId(), detail);
        return ReconcileOutcome.builder()
                .result(ReconcileOutcome.Result.POOL_RENTAL_COMPLETED)
                .paymentReference(reference.getValue())
                .poolRental(saved)
                .build();
    }

    /**
     * Picks the event/driver split of a race reference: prefer one where both records exist, then
     * one where the event exists, then the first split.
     */
    PaymentReference.RaceParties resolveParties(PaymentReference.Race reference) {
        if (!reference.isAmbiguous()) {
            return reference.getPrimary();
        }
        PaymentReference.RaceParties eventOnly = null;
        for (PaymentReference.RaceParties candidate : reference.getCandidates()) {
            boolean eventKnown = eventRepository.existsById(candidate.getEventId());
            if (eventKnown && driverRepository.existsById(candidate.getDriverId())) {
                return candidate;
            }
            if (eventKnown && eventOnly == null) {
                eventOnly = candidate;
            }
        }
        return eventOnly != null ? eventOnly : reference.getPrimary();
    }

    private void afterCommit(ReconcileOutcome outcome, String actor) {
        switch (outcome.getResult()) {
            case ENTRY_COMPLETED:
                RaceEntryEntity entry = outcome.getEntry();
                auditLogger.logTransition(entry.getEntryId(), entry.getPaymentReference(),
                        outcome.getPreviousStatus(), PaymentStatus.COMPLETED, actor);
                eventProducer.publishEntry("ENTRY_COMPLETED", entry, actor);
                if (outcome.getPreviousStatus() == PaymentStatus.FAILED) {
                    notifications.adminActivity("Payment after cancellation", entry.getDriverId(), entry.getPaymentReference());
                }
                break;
            case LATE_ENTRY_CREATED:
                RaceEntryEntity late = outcome.getEntry();
                auditLogger.logTransition(late.getEntryId(), late.getPaymentReference(), null, PaymentStatus.COMPLETED, actor);
                eventProducer.publishEntry("ENTRY_COMPLETED", late, actor);
                notifications.adminActivity("Late payment", late.getDriverId(), late.getPaymentReference());
                break;
            case POOL_RENTAL_COMPLETED:
                PoolEngineRentalEntity rental = outcome.getPoolRental();
                auditLogger.logPoolRental(rental.getRentalId(), rental.getPaymentReference(), PaymentStatus.COMPLETED, actor);
                eventProducer.publishPoolRental("POOL_RENTAL_COMPLETED", rental, actor);
                driverRepository.findById(rental.getDriverId()).ifPresent(driver ->
                        notifications.poolRentalConfirmation(driver, rental));
                notifications.adminActivity("Pool engine rental", rental.getDriverId(), rental.getPaymentReference());
                break;
            default:
                break;
        }
    }

    private static PaymentLedgerEntity ledgerRow(WebhookNotification notification, String source) {
        return PaymentLedgerEntity.builder()
                .pfPaymentId(notification.getPfPaymentId())
                .paymentReference(notification.getPaymentReference().getValue())
                .amountGross(notification.getAmountGross())
                .paymentStatus(notification.getRawPaymentStatus() == null
                        ? notification.getPaymentStatus().name()
                        : notification.getRawPaymentStatus().trim().toUpperCase(Locale.ROOT))
                .payerEmail(notification.getPayerEmail())
                .payerFirstName(notification.getPayerFirstName())
                .payerLastName(notification.getPayerLastName())
                .itemName(notification.getItemName())
                .source(source)
                .rawPayload(toJson(notification.getRawFields()))
                .completedAt(notification.isComplete() ? Instant.now() : null)
                .build();
    }

    private static ReconcileOutcome outcome(ReconcileOutcome.Result result, PaymentReference reference) {
        return ReconcileOutcome.builder().result(result).paymentReference(reference.getValue()).build();
    }

    private static String joinName(WebhookNotification notification) {
        String first = notification.getPayerFirstName() == null ? "" : notification.getPayerFirstName();
        String last = notification.getPayerLastName() == null ? "" : notification.getPayerLastName();
        return (first + " " + last).trim();
    }

    static String toJson(Map<String, String> fields) {
        try {
            return PAYLOAD_MAPPER.writeValueAsString(fields == null ? Map.of() : new TreeMap<>(fields));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload not serialisable", e);
        }
    }
}

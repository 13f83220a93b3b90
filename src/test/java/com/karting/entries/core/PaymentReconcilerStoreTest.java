package com.karting.entries.core;

import com.karting.entries.api.EntryServiceException;
import com.karting.entries.compliance.ComplianceAuditLogger;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.GatewayPaymentStatus;
import com.karting.entries.domain.PaymentReference;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.domain.WebhookNotification;
import com.karting.entries.mail.EntryNotifications;
import com.karting.entries.messaging.EntryEventProducer;
import com.karting.entries.persistence.entity.AuditLogEntity;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.PaymentLedgerEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.AuditLogRepository;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.FailedNotificationRepository;
import com.karting.entries.persistence.repository.PaymentLedgerRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reconciliation against H2 with the real store. Each store call commits on its own, as it does
 * in the running service, so a rolled back ledger row would show up here.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({EntryStore.class, StoreTransactions.class, PaymentReconciler.class, ComplianceAuditLogger.class,
        PaymentReconcilerStoreTest.RetryConfiguration.class})
class PaymentReconcilerStoreTest {

    private static final String DRIVER_ID = "DRV7";
    private static final String EVENT_ID = "NATS1";
    private static final BigDecimal AMOUNT = new BigDecimal("14900.00");

    @TestConfiguration
    static class RetryConfiguration {
        @Bean
        RetryRegistry retryRegistry() {
            return RetryRegistry.of(RetryConfig.custom()
                    .maxAttempts(2)
                    .waitDuration(Duration.ofMillis(10))
                    .ignoreExceptions(EntryServiceException.class)
                    .build());
        }
    }

    @MockitoBean
    private EntryNotifications notifications;
    @MockitoBean
    private EntryEventProducer eventProducer;

    @Autowired
    private PaymentReconciler reconciler;
    @Autowired
    private EntryStore entryStore;
    @Autowired
    private StoreTransactions transactions;
    @Autowired
    private RaceEntryRepository entryRepository;
    @Autowired
    private PaymentLedgerRepository ledgerRepository;
    @Autowired
    private AuditLogRepository auditLogRepository;
    @Autowired
    private FailedNotificationRepository failedNotificationRepository;
    @Autowired
    private DriverRepository driverRepository;

    @BeforeEach
    void setUp() {
        clearTables();
        driverRepository.saveAndFlush(DriverEntity.builder()
                .driverId(DRIVER_ID)
                .email("dee@example.test")
                .firstName("Dee")
                .lastName("Kart")
                .championshipClass("Senior Rotax")
                .build());
    }

    @AfterEach
    void tearDown() {
        clearTables();
    }

    @Test
    void webhookCompletesPendingEntry() {
        String reference = pendingEntry(1L);

        ReconcileOutcome outcome = reconciler.reconcileNotification(webhook(reference, "PF-1001"));

        assertThat(outcome.getResult()).isEqualTo(ReconcileOutcome.Result.ENTRY_COMPLETED);
        RaceEntryEntity stored = single(reference);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(stored.getEntryStatus()).isEqualTo(EntryStatus.CONFIRMED);
        assertThat(stored.getPfPaymentId()).isEqualTo("PF-1001");
        assertThat(ledgerRows(reference)).hasSize(1);
        assertThat(auditActions()).contains("entry_completed");
        DriverEntity driver = driverRepository.findById(DRIVER_ID).orElseThrow();
        assertThat(driver.getNextRaceEntryStatus()).isEqualTo(DriverEntity.STATUS_REGISTERED);
        assertThat(driver.getNextRaceEngineRentalStatus()).isEqualTo(DriverEntity.RENTAL_BOOKED);
    }

    @Test
    void repeatedWebhookChangesNothing() {
        String reference = pendingEntry(2L);
        reconciler.reconcileNotification(webhook(reference, "PF-1002"));
        long auditRows = auditLogRepository.count();

        ReconcileOutcome again = reconciler.reconcileNotification(webhook(reference, "PF-1002"));

        assertThat(again.getResult()).isEqualTo(ReconcileOutcome.Result.ALREADY_APPLIED);
        assertThat(ledgerRows(reference)).hasSize(1);
        assertThat(auditLogRepository.count()).isEqualTo(auditRows);
        assertThat(single(reference).getPfPaymentId()).isEqualTo("PF-1002");
    }

    @Test
    void lateWebhookSynthesisesConfirmedEntry() {
        String reference = PaymentReference.race(EVENT_ID, DRIVER_ID, 1700000000003L).getValue();

        ReconcileOutcome outcome = reconciler.reconcileNotification(webhook(reference, "PF-1003"));

        assertThat(outcome.getResult()).isEqualTo(ReconcileOutcome.Result.LATE_ENTRY_CREATED);
        RaceEntryEntity stored = single(reference);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(stored.getRaceClass()).isEqualTo("Senior Rotax");
        assertThat(ledgerRows(reference)).hasSize(1);
        assertThat(auditActions()).contains("late_webhook");
    }

    @Test
    void adminReconcileThenRealWebhookRecordsGatewayIdOnly() {
        String reference = pendingEntry(4L);

        ReconcileOutcome manual = reconciler.reconcileManually(manualRequest(reference, null));
        ReconcileOutcome webhook = reconciler.reconcileNotification(webhook(reference, "PF-1004"));

        assertThat(manual.getResult()).isEqualTo(ReconcileOutcome.Result.ENTRY_COMPLETED);
        assertThat(webhook.getResult()).isEqualTo(ReconcileOutcome.Result.ALREADY_APPLIED);
        RaceEntryEntity stored = single(reference);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(stored.getPfPaymentId()).isEqualTo("PF-1004");
        assertThat(ledgerRows(reference)).extracting(PaymentLedgerEntity::getSource)
                .containsExactlyInAnyOrder(PaymentLedgerEntity.SOURCE_ADMIN, PaymentLedgerEntity.SOURCE_WEBHOOK);
        assertThat(auditActions()).containsOnlyOnce("entry_completed").contains("gateway_id_recorded");
    }

    @Test
    void adminReconcileAndWebhookCommuteWithoutGatewayIdFromOperator() {
        String adminFirst = pendingEntry(5L);
        String webhookFirst = pendingEntry(6L);

        reconciler.reconcileManually(manualRequest(adminFirst, null));
        reconciler.reconcileNotification(webhook(adminFirst, "PF-1005"));
        reconciler.reconcileNotification(webhook(webhookFirst, "PF-1006"));
        reconciler.reconcileManually(manualRequest(webhookFirst, null));

        RaceEntryEntity a = single(adminFirst);
        RaceEntryEntity b = single(webhookFirst);
        assertThat(a.getPaymentStatus()).isEqualTo(b.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(a.getEntryStatus()).isEqualTo(b.getEntryStatus()).isEqualTo(EntryStatus.CONFIRMED);
        assertThat(a.getPfPaymentId()).isEqualTo("PF-1005");
        assertThat(b.getPfPaymentId()).isEqualTo("PF-1006");
    }

    @Test
    void adminReconcileIsIdempotent() {
        String reference = pendingEntry(7L);

        ReconcileOutcome first = reconciler.reconcileManually(manualRequest(reference, "PF-1007"));
        ReconcileOutcome second = reconciler.reconcileManually(manualRequest(reference, "PF-1007"));

        assertThat(first.getResult()).isEqualTo(ReconcileOutcome.Result.ENTRY_COMPLETED);
        assertThat(second.getResult()).isEqualTo(ReconcileOutcome.Result.ALREADY_APPLIED);
        assertThat(entryRepository.findByPaymentReference(reference)).hasSize(1);
        assertThat(ledgerRows(reference)).hasSize(1);
    }

    @Test
    void paymentForCancelledEntryCommitsLedgerAndConfirmsEntry() {
        String reference = cancelledEntry(8L);

        ReconcileOutcome webhook = reconciler.reconcileNotification(webhook(reference, "PF-1008"));
        ReconcileOutcome manual = reconciler.reconcileManually(manualRequest(reference, "PF-1008"));

        assertThat(webhook.getResult()).isEqualTo(ReconcileOutcome.Result.ENTRY_COMPLETED);
        assertThat(manual.getResult()).isEqualTo(ReconcileOutcome.Result.ALREADY_APPLIED);
        assertThat(ledgerRows(reference)).isNotEmpty();
        List<RaceEntryEntity> confirmed = entryRepository.findByPaymentReference(reference).stream()
                .filter(e -> e.getEntryStatus() == EntryStatus.CONFIRMED)
                .collect(Collectors.toList());
        assertThat(confirmed).hasSize(1);
        assertThat(confirmed.get(0).getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(auditActions()).contains("payment_after_cancel");
        assertThat(failedNotificationRepository.count()).isZero();
        assertThat(driverRepository.findById(DRIVER_ID).orElseThrow().getNextRaceEntryStatus())
                .isEqualTo(DriverEntity.STATUS_REGISTERED);
    }

    @Test
    void adminReconcileOverridesCancellation() {
        String reference = cancelledEntry(9L);

        ReconcileOutcome outcome = reconciler.reconcileManually(manualRequest(reference, null));

        assertThat(outcome.getResult()).isEqualTo(ReconcileOutcome.Result.ENTRY_COMPLETED);
        assertThat(outcome.getPreviousStatus()).isEqualTo(PaymentStatus.FAILED);
        RaceEntryEntity stored = single(reference);
        assertThat(stored.getEntryStatus()).isEqualTo(EntryStatus.CONFIRMED);
        assertThat(stored.getPfPaymentId()).isEqualTo("MANUAL-" + reference);
        assertThat(ledgerRows(reference)).hasSize(1);
    }

    private String pendingEntry(long suffix) {
        String reference = PaymentReference.race(EVENT_ID, DRIVER_ID, 1700000000000L + suffix).getValue();
        transactions.run("seed_entry", () -> entryStore.createPendingEntry(RaceEntryEntity.builder()
                .entryId(UUID.randomUUID().toString())
                .driverId(DRIVER_ID)
                .eventId(EVENT_ID)
                .raceClass("Senior Rotax")
                .entryItems(new ArrayList<>(List.of(EntryItem.ENGINE, EntryItem.TYRES)))
                .amountPaid(AMOUNT)
                .paymentReference(reference)
                .paymentStatus(PaymentStatus.PENDING)
                .entryStatus(EntryStatus.PENDING_PAYMENT)
                .build()));
        return reference;
    }

    private String cancelledEntry(long suffix) {
        String reference = pendingEntry(suffix);
        RaceEntryEntity row = single(reference);
        row.setPaymentStatus(PaymentStatus.FAILED);
        row.setEntryStatus(EntryStatus.CANCELLED);
        entryRepository.saveAndFlush(row);
        return reference;
    }

    private RaceEntryEntity single(String reference) {
        List<RaceEntryEntity> rows = entryRepository.findByPaymentReference(reference);
        assertThat(rows).hasSize(1);
        return rows.get(0);
    }

    private List<PaymentLedgerEntity> ledgerRows(String reference) {
        return ledgerRepository.findAll().stream()
                .filter(row -> reference.equals(row.getPaymentReference()))
                .collect(Collectors.toList());
    }

    private List<String> auditActions() {
        return auditLogRepository.findAll().stream().map(AuditLogEntity::getAction).collect(Collectors.toList());
    }

    private void clearTables() {
        auditLogRepository.deleteAll();
        failedNotificationRepository.deleteAll();
        ledgerRepository.deleteAll();
        entryRepository.deleteAll();
        driverRepository.deleteAll();
    }

    private static WebhookNotification webhook(String reference, String pfPaymentId) {
        return WebhookNotification.builder()
                .paymentReference(PaymentReference.parse(reference))
                .pfPaymentId(pfPaymentId)
                .amountGross(AMOUNT)
                .paymentStatus(GatewayPaymentStatus.COMPLETE)
                .rawPaymentStatus("COMPLETE")
                .payerEmail("dee@example.test")
                .rawFields(Map.of("m_payment_id", reference, "pf_payment_id", pfPaymentId, "payment_status", "COMPLETE"))
                .build();
    }

    private static AdminReconcileRequest manualRequest(String reference, String pfPaymentId) {
        return AdminReconcileRequest.builder()
                .paymentReference(reference)
                .pfPaymentId(pfPaymentId)
                .amount(AMOUNT)
                .actor("ops@example.test")
                .build();
    }
}

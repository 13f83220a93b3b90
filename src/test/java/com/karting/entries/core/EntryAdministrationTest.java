package com.karting.entries.core;

import com.karting.entries.api.PaymentStateMismatchException;
import com.karting.entries.api.ValidationFailedException;
import com.karting.entries.compliance.ComplianceAuditLogger;
import com.karting.entries.domain.DiscountType;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.messaging.EntryEventProducer;
import com.karting.entries.persistence.entity.DiscountCodeEntity;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.EventEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.DiscountCodeRepository;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.EventRepository;
import com.karting.entries.persistence.repository.FailedNotificationRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntryAdministrationTest {

    @Mock
    private RaceEntryRepository entryRepository;
    @Mock
    private EventRepository eventRepository;
    @Mock
    private DriverRepository driverRepository;
    @Mock
    private DiscountCodeRepository discountCodeRepository;
    @Mock
    private FailedNotificationRepository failedNotificationRepository;
    @Mock
    private EntryStore entryStore;
    @Mock
    private StoreTransactions transactions;
    @Mock
    private EntryEventProducer eventProducer;
    @Mock
    private ComplianceAuditLogger auditLogger;

    private EntryAdministration administration;

    @BeforeEach
    void setUp() {
        administration = new EntryAdministration(entryRepository, eventRepository, driverRepository,
                discountCodeRepository, failedNotificationRepository, entryStore, transactions, new TicketMint(),
                eventProducer, auditLogger);
        lenient().when(transactions.execute(anyString(), any()))
                .thenAnswer(inv -> inv.<Supplier<?>>getArgument(1).get());
    }

    @Test
    void editMintsTicketsForAddedItemsAndDropsRemovedOnes() {
        RaceEntryEntity entry = entry(PaymentStatus.COMPLETED, EntryStatus.CONFIRMED);
        entry.setTicketEngineRef("ENG-D001-ERED-1700000000000-AAAAAA");
        when(entryRepository.findById("entry-1")).thenReturn(Optional.of(entry));
        when(entryRepository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        RaceEntryEntity edited = administration.editEntry("entry-1", EntryEdit.builder()
                .raceClass("Senior Max")
                .items(List.of("tyres", "fuel"))
                .actor("ops@example.test")
                .build());

        assertThat(edited.getRaceClass()).isEqualTo("Senior Max");
        assertThat(edited.getEntryItems()).containsExactly(EntryItem.TYRES, EntryItem.FUEL);
        assertThat(edited.getTicketEngineRef()).isNull();
        assertThat(edited.getTicketTyresRef()).startsWith("TYR-D001-ERED-");
        assertThat(edited.getTicketFuelRef()).startsWith("FUEL-D001-ERED-");
        assertThat(edited.getAmountPaid()).isEqualByComparingTo("14900.00");
        verify(entryStore).appendAudit(eq("entry_edited"), eq("ops@example.test"), eq("entry-1"), anyMap());
        verify(eventProducer).publishEntry("ENTRY_EDITED", edited, "ops@example.test");
    }

    @Test
    void keptItemKeepsItsTicket() {
        RaceEntryEntity entry = entry(PaymentStatus.COMPLETED, EntryStatus.CONFIRMED);
        entry.setTicketEngineRef("ENG-D001-ERED-1700000000000-AAAAAA");
        when(entryRepository.findById("entry-1")).thenReturn(Optional.of(entry));
        when(entryRepository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        RaceEntryEntity edited = administration.editEntry("entry-1", EntryEdit.builder()
                .items(List.of("engine"))
                .teamCode("")
                .build());

        assertThat(edited.getTicketEngineRef()).isEqualTo("ENG-D001-ERED-1700000000000-AAAAAA");
        assertThat(edited.getTeamCode()).isNull();
        verify(entryStore).appendAudit(eq("entry_edited"), eq("admin"), eq("entry-1"), anyMap());
    }

    @Test
    void cancelledEntryCannotBeEdited() {
        when(entryRepository.findById("entry-1")).thenReturn(Optional.of(entry(PaymentStatus.FAILED, EntryStatus.CANCELLED)));

        assertThatThrownBy(() -> administration.editEntry("entry-1", EntryEdit.builder().raceClass("Senior Max").build()))
                .isInstanceOf(PaymentStateMismatchException.class);
        verify(entryRepository, never()).saveAndFlush(any());
    }

    @Test
    void cancelAppliesWhenStatusStillMatches() {
        RaceEntryEntity pending = entry(PaymentStatus.PENDING, EntryStatus.PENDING_PAYMENT);
        RaceEntryEntity cancelled = pending.toBuilder()
                .paymentStatus(PaymentStatus.FAILED)
                .entryStatus(EntryStatus.CANCELLED)
                .build();
        when(entryRepository.findById("entry-1")).thenReturn(Optional.of(pending), Optional.of(cancelled));
        when(entryRepository.cancelIfStatus(eq("entry-1"), eq(PaymentStatus.PENDING), any(),
                eq(PaymentStatus.FAILED), eq(EntryStatus.CANCELLED))).thenReturn(1);

        RaceEntryEntity result = administration.cancelEntry("entry-1", PaymentStatus.PENDING, "ops@example.test");

        assertThat(result.getEntryStatus()).isEqualTo(EntryStatus.CANCELLED);
        verify(driverRepository).updateNextRaceStatus("D-001", DriverEntity.STATUS_NOT_REGISTERED, DriverEntity.RENTAL_NONE);
        verify(entryStore).appendAudit(eq("entry_cancelled"), eq("ops@example.test"), eq("entry-1"),
                argThat(detail -> PaymentStatus.PENDING.equals(detail.get("previousStatus"))));
        verify(auditLogger).logTransition("entry-1", pending.getPaymentReference(), PaymentStatus.PENDING,
                PaymentStatus.FAILED, "ops@example.test");
    }

    @Test
    void cancelLosesToAConcurrentCompletion() {
        RaceEntryEntity pending = entry(PaymentStatus.PENDING, EntryStatus.PENDING_PAYMENT);
        RaceEntryEntity completed = pending.toBuilder().paymentStatus(PaymentStatus.COMPLETED).build();
        when(entryRepository.findById("entry-1")).thenReturn(Optional.of(pending), Optional.of(completed));
        when(entryRepository.cancelIfStatus(eq("entry-1"), eq(PaymentStatus.PENDING), any(),
                eq(PaymentStatus.FAILED), eq(EntryStatus.CANCELLED))).thenReturn(0);

        assertThatThrownBy(() -> administration.cancelEntry("entry-1", PaymentStatus.PENDING, null))
                .isInstanceOf(PaymentStateMismatchException.class)
                .hasMessageContaining("COMPLETED");
        verify(driverRepository, never()).updateNextRaceStatus(anyString(), anyString(), anyString());
        verify(eventProducer, never()).publishEntry(anyString(), any(), anyString());
    }

    @Test
    void alreadyCancelledEntryIsRejected() {
        when(entryRepository.findById("entry-1")).thenReturn(Optional.of(entry(PaymentStatus.FAILED, EntryStatus.CANCELLED)));

        assertThatThrownBy(() -> administration.cancelEntry("entry-1", null, null))
                .isInstanceOf(PaymentStateMismatchException.class);
    }

    @Test
    void listEntriesScopesToEventWhenGiven() {
        administration.listEntries("E-RED");
        administration.listEntries(" ");

        verify(entryRepository).findByEventIdOrderByCreatedAtAsc("E-RED");
        verify(entryRepository).findAllByOrderByCreatedAtDesc();
    }

    @Test
    void failedNotificationLimitIsClamped() {
        administration.listFailedNotifications(10_000);

        verify(failedNotificationRepository).findAllByOrderByOccurredAtDesc(
                argThat((Pageable page) -> page.getPageSize() == 500));
    }

    @Test
    void createEventRejectsExistingId() {
        when(eventRepository.existsById("E-RED")).thenReturn(true);

        assertThatThrownBy(() -> administration.createEvent(definition("E-RED"), "ops"))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void createEventRejectsIdOutsideReferenceAlphabet() {
        assertThatThrownBy(() -> administration.createEvent(definition("Red Star"), "ops"))
                .isInstanceOf(ValidationFailedException.class);
    }

    @Test
    void createEventSavesAndAudits() {
        when(eventRepository.existsById("E-BLUE")).thenReturn(false);
        when(eventRepository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        EventEntity saved = administration.createEvent(definition("E-BLUE"), null);

        assertThat(saved.getName()).isEqualTo("Blue Ridge Round 2");
        assertThat(saved.isRegistrationOpen()).isTrue();
        verify(entryStore).appendAudit(eq("event_created"), eq("admin"), eq("E-BLUE"), anyMap());
    }

    @Test
    void discountUpsertValidatesPercentRange() {
        assertThatThrownBy(() -> administration.upsertDiscountCode("HALF", DiscountType.PERCENT,
                new BigDecimal("150"), null, true, "ops"))
                .isInstanceOf(ValidationFailedException.class);
        assertThatThrownBy(() -> administration.upsertDiscountCode("FIX", DiscountType.FIXED,
                BigDecimal.ZERO, null, true, "ops"))
                .isInstanceOf(ValidationFailedException.class);
    }

    @Test
    void discountUpsertReplacesExistingCode() {
        DiscountCodeEntity existing = DiscountCodeEntity.builder()
                .code("KOKOROKO").discountType(DiscountType.PERCENT).discountValue(new BigDecimal("10")).active(true).build();
        when(discountCodeRepository.findByCodeIgnoreCase("kokoroko")).thenReturn(Optional.of(existing));
        when(discountCodeRepository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        DiscountCodeEntity saved = administration.upsertDiscountCode("kokoroko", DiscountType.FREE, null,
                "Sponsor entry", false, "ops");

        assertThat(saved.getCode()).isEqualTo("KOKOROKO");
        assertThat(saved.getDiscountType()).isEqualTo(DiscountType.FREE);
        assertThat(saved.getDiscountValue()).isNull();
        assertThat(saved.isActive()).isFalse();
        verify(entryStore).appendAudit(eq("discount_code_upserted"), eq("ops"), eq("KOKOROKO"), anyMap());
    }

    private static RaceEntryEntity entry(PaymentStatus paymentStatus, EntryStatus entryStatus) {
        return RaceEntryEntity.builder()
                .entryId("entry-1")
                .driverId("D-001")
                .eventId("E-RED")
                .raceClass("Senior Rotax")
                .entryItems(new ArrayList<>(List.of(EntryItem.ENGINE)))
                .amountPaid(new BigDecimal("14900.00"))
                .paymentReference("RACE-E-RED-D-001-1700000000000")
                .paymentStatus(paymentStatus)
                .entryStatus(entryStatus)
                .build();
    }

    private static EventDefinition definition(String eventId) {
        return EventDefinition.builder()
                .eventId(eventId)
                .name("Blue Ridge Round 2")
                .eventDate(LocalDate.of(2026, 5, 9))
                .venue("Blue Ridge")
                .entryFee(new BigDecimal("2950.00"))
                .registrationOpen(true)
                .build();
    }
}

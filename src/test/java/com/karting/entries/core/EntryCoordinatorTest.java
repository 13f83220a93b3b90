package com.karting.entries.core;

import com.karting.entries.api.DiscountInvalidException;
import com.karting.entries.api.RegistrationClosedException;
import com.karting.entries.api.ValidationFailedException;
import com.karting.entries.compliance.ComplianceAuditLogger;
import com.karting.entries.domain.DiscountType;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.GatewayCheckout;
import com.karting.entries.domain.GatewayForm;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.mail.EntryNotifications;
import com.karting.entries.messaging.EntryEventProducer;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.EventEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.EventRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreResult;
import com.karting.entries.persistence.service.StoreTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Initiation paths of the coordinator against mocked collaborators. Pricing itself is covered by
 * {@link PriceCalculatorTest}.
 */
@ExtendWith(MockitoExtension.class)
class EntryCoordinatorTest {

    @Mock
    private EventRepository eventRepository;
    @Mock
    private DriverRepository driverRepository;
    @Mock
    private RaceEntryRepository entryRepository;
    @Mock
    private EntryStore entryStore;
    @Mock
    private StoreTransactions transactions;
    @Mock
    private PriceCalculator priceCalculator;
    @Mock
    private GatewayAdapter gatewayAdapter;
    @Mock
    private InitiationIdempotencyService idempotencyService;
    @Mock
    private EntryNotifications notifications;
    @Mock
    private EntryEventProducer eventProducer;
    @Mock
    private ComplianceAuditLogger auditLogger;

    private EntryCoordinator coordinator;
    private EventEntity event;
    private DriverEntity driver;

    @BeforeEach
    void setUp() {
        coordinator = new EntryCoordinator(eventRepository, driverRepository, entryRepository, entryStore,
                transactions, priceCalculator, new TicketMint(), gatewayAdapter, idempotencyService,
                notifications, eventProducer, auditLogger);
        ReflectionTestUtils.setField(coordinator, "returnUrl", "https://entries.example.test/ok");
        ReflectionTestUtils.setField(coordinator, "cancelUrl", "https://entries.example.test/cancel");
        ReflectionTestUtils.setField(coordinator, "notifyUrl", "https://entries.example.test/notify");

        event = EventEntity.builder()
                .eventId("E-RED")
                .name("Red Star Nationals")
                .registrationOpen(true)
                .registrationDeadline(Instant.now().plusSeconds(86_400))
                .entryFee(new BigDecimal("2950.00"))
                .build();
        driver = DriverEntity.builder()
                .driverId("D-001")
                .email("dee@example.test")
                .firstName("Dee")
                .lastName("River")
                .build();
        lenient().when(eventRepository.findById("E-RED")).thenReturn(Optional.of(event));
        lenient().when(driverRepository.findById("D-001")).thenReturn(Optional.of(driver));
        lenient().when(transactions.execute(anyString(), any()))
                .thenAnswer(inv -> inv.<Supplier<?>>getArgument(1).get());
        lenient().when(entryStore.createPendingEntry(any()))
                .thenAnswer(inv -> StoreResult.created(inv.getArgument(0)));
        lenient().when(entryStore.insertCompletedEntry(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void paidInitiationWritesPendingEntryAndReturnsForm() {
        when(priceCalculator.quoteEntry(eq(event), eq("Senior Rotax"), anyList(), isNull()))
                .thenReturn(quote("14900.00", null, null));
        when(gatewayAdapter.buildCheckoutForm(any()))
                .thenAnswer(inv -> form(inv.<GatewayCheckout>getArgument(0).getPaymentReference()));

        InitiationResult result = coordinator.initiatePaidEntry(EntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax")
                .item("Engine Rental").item("tyres")
                .build());

        RaceEntryEntity entry = result.getEntry();
        assertThat(result.isFree()).isFalse();
        assertThat(result.isReplayed()).isFalse();
        assertThat(entry.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(entry.getAmountPaid()).isEqualByComparingTo("14900.00");
        assertThat(entry.getPaymentReference()).startsWith("RACE-E-RED-D-001-");
        assertThat(entry.getEntryItems()).containsExactly(EntryItem.ENGINE, EntryItem.TYRES);
        assertThat(entry.getTicketEngineRef()).startsWith("ENG-D001-ERED-");
        assertThat(entry.getTicketTyresRef()).startsWith("TYR-");
        assertThat(entry.getTicketFuelRef()).isNull();
        assertThat(result.getGatewayForm().getPaymentReference()).isEqualTo(entry.getPaymentReference());

        ArgumentCaptor<GatewayCheckout> checkout = ArgumentCaptor.forClass(GatewayCheckout.class);
        verify(gatewayAdapter).buildCheckoutForm(checkout.capture());
        assertThat(checkout.getValue().getItemDescription()).isEqualTo("Red Star Nationals (Senior Rotax): Engine Rental, Tyres");
        verify(entryStore).appendAudit(eq("entry_initiated"), eq("driver"), eq(entry.getEntryId()), anyMap());
        verify(eventProducer).publishEntry("ENTRY_INITIATED", entry, "driver");
        verify(notifications).raceEntryConfirmation(driver, event, entry);
    }

    @Test
    void freeCodeDivertsToFreeEntry() {
        when(priceCalculator.quoteEntry(eq(event), eq("Senior Rotax"), anyList(), eq("KOKOROKO")))
                .thenReturn(quote("0", "KOKOROKO", DiscountType.FREE));

        InitiationResult result = coordinator.initiatePaidEntry(EntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax")
                .item("engine").discountCode("KOKOROKO")
                .build());

        assertThat(result.isFree()).isTrue();
        assertThat(result.getEntry().getPaymentStatus()).isEqualTo(PaymentStatus.FREE);
        assertThat(result.getEntry().getAmountPaid()).isEqualByComparingTo("0");
        assertThat(result.getEntry().getTeamCode()).isEqualTo("KOKOROKO");
        verifyNoInteractions(gatewayAdapter);
        verify(driverRepository).updateNextRaceStatus("D-001", DriverEntity.STATUS_REGISTERED, DriverEntity.RENTAL_BOOKED);
        verify(entryStore).appendAudit(eq("entry_free"), eq("driver"), anyString(), anyMap());
    }

    @Test
    void zeroTotalFromNonFreeCodeIsRejected() {
        when(priceCalculator.quoteEntry(eq(event), eq("Senior Rotax"), anyList(), eq("HALFOFF")))
                .thenReturn(quote("0", "HALFOFF", DiscountType.PERCENT));

        assertThatThrownBy(() -> coordinator.initiatePaidEntry(EntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax").discountCode("HALFOFF")
                .build()))
                .isInstanceOf(DiscountInvalidException.class);
        verify(entryStore, never()).createPendingEntry(any());
    }

    @Test
    void closedRegistrationIsRejectedBeforePricing() {
        event.setRegistrationDeadline(Instant.now().minusSeconds(60));

        assertThatThrownBy(() -> coordinator.initiatePaidEntry(EntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax")
                .build()))
                .isInstanceOf(RegistrationClosedException.class);
        verifyNoInteractions(priceCalculator, entryStore);
    }

    @Test
    void repeatedRequestKeyReplaysEarlierReference() {
        RaceEntryEntity prior = RaceEntryEntity.builder()
                .entryId("entry-1")
                .driverId("D-001")
                .eventId("E-RED")
                .raceClass("Senior Rotax")
                .entryItems(List.of())
                .amountPaid(new BigDecimal("2950.00"))
                .paymentReference("RACE-E-RED-D-001-1700000000000")
                .paymentStatus(PaymentStatus.PENDING)
                .build();
        when(idempotencyService.findPrior("D-001:client-key-1")).thenReturn(Optional.of(prior));
        when(gatewayAdapter.buildCheckoutForm(any()))
                .thenAnswer(inv -> form(inv.<GatewayCheckout>getArgument(0).getPaymentReference()));

        InitiationResult result = coordinator.initiatePaidEntry(EntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax").requestKey("client-key-1")
                .build());

        assertThat(result.isReplayed()).isTrue();
        assertThat(result.getPaymentReference()).isEqualTo("RACE-E-RED-D-001-1700000000000");
        verifyNoInteractions(entryStore, notifications, priceCalculator);
    }

    @Test
    void repeatedRequestKeyForPaidEntryIssuesNoSecondForm() {
        RaceEntryEntity paid = RaceEntryEntity.builder()
                .entryId("entry-1")
                .driverId("D-001")
                .eventId("E-RED")
                .raceClass("Senior Rotax")
                .entryItems(List.of())
                .amountPaid(new BigDecimal("2950.00"))
                .paymentReference("RACE-E-RED-D-001-1700000000000")
                .pfPaymentId("1089250")
                .paymentStatus(PaymentStatus.COMPLETED)
                .entryStatus(EntryStatus.CONFIRMED)
                .build();
        when(idempotencyService.findPrior("D-001:client-key-1")).thenReturn(Optional.of(paid));

        InitiationResult result = coordinator.initiatePaidEntry(EntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax").requestKey("client-key-1")
                .build());

        assertThat(result.isReplayed()).isTrue();
        assertThat(result.isAwaitingPayment()).isFalse();
        assertThat(result.isFree()).isFalse();
        assertThat(result.getGatewayForm()).isNull();
        assertThat(result.getEntry().getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        verifyNoInteractions(gatewayAdapter, entryStore, notifications, priceCalculator);
    }

    @Test
    void unknownItemIsAValidationFailure() {
        assertThatThrownBy(() -> coordinator.initiatePaidEntry(EntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax").item("chassis")
                .build()))
                .isInstanceOf(ValidationFailedException.class);
    }

    @Test
    void manualEntryRejectsFailedStatus() {
        assertThatThrownBy(() -> coordinator.addManualEntry(ManualEntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax")
                .paymentStatus(PaymentStatus.FAILED)
                .build()))
                .isInstanceOf(ValidationFailedException.class);
    }

    @Test
    void manualCompletedEntryIgnoresClosedWindow() {
        event.setRegistrationOpen(false);
        when(priceCalculator.quoteEntry(eq(event), eq("Senior Rotax"), anyList(), isNull()))
                .thenReturn(quote("2950.00", null, null));

        RaceEntryEntity entry = coordinator.addManualEntry(ManualEntryRequest.builder()
                .driverId("D-001").eventId("E-RED").raceClass("Senior Rotax")
                .paymentStatus(PaymentStatus.COMPLETED).actor("ops@example.test")
                .build());

        assertThat(entry.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        verify(entryStore).appendAudit(eq("entry_manual"), eq("ops@example.test"), eq(entry.getEntryId()), anyMap());
        verify(notifications, never()).raceEntryConfirmation(any(), any(), any());
    }

    private static Quote quote(String total, String code, DiscountType type) {
        return Quote.builder()
                .baseFee(new BigDecimal("2950.00"))
                .itemsTotal(BigDecimal.ZERO)
                .discount(BigDecimal.ZERO)
                .total(new BigDecimal(total))
                .discountCode(code)
                .discountType(type)
                .build();
    }

    private static GatewayForm form(String reference) {
        return new GatewayForm("https://sandbox.payfast.co.za/eng/process", Map.of("m_payment_id", reference), reference);
    }
}

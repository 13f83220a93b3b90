package com.karting.entries.core;

import com.karting.entries.api.DiscountInvalidException;
import com.karting.entries.api.NotFoundException;
import com.karting.entries.api.RegistrationClosedException;
import com.karting.entries.api.ValidationFailedException;
import com.karting.entries.compliance.ComplianceAuditLogger;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.GatewayCheckout;
import com.karting.entries.domain.GatewayForm;
import com.karting.entries.domain.PaymentReference;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Starts race entries: paid initiation, free entries and admin manual entries. Completion of
 * paid entries happens in {@link PaymentReconciler}.
 * <p>
 * Every entry is written in one transaction together with its audit row; e-mail and domain
 * events follow the commit and never affect it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryCoordinator {

    static final String ACTOR_DRIVER = "driver";

    private final EventRepository eventRepository;
    private final DriverRepository driverRepository;
    private final RaceEntryRepository entryRepository;
    private final EntryStore entryStore;
    private final StoreTransactions transactions;
    private final PriceCalculator priceCalculator;
    private final TicketMint ticketMint;
    private final GatewayAdapter gatewayAdapter;
    private final InitiationIdempotencyService idempotencyService;
    private final EntryNotifications notifications;
    private final EntryEventProducer eventProducer;
    private final ComplianceAuditLogger auditLogger;

    @Value("${karting.payfast.return-url:http://localhost:8080/payment-success.html}")
    private String returnUrl;

    @Value("${karting.payfast.cancel-url:http://localhost:8080/payment-cancel.html}")
    private String cancelUrl;

    @Value("${karting.payfast.notify-url:http://localhost:8080/api/v1/payments/notify}")
    private String notifyUrl;

    /**
     * Write a Pending entry and return the gateway form for it. A code that makes the entry
     * free diverts to {@link #completeFreeEntry}; a repeated client key returns the earlier result.
     */
    public InitiationResult initiatePaidEntry(EntryRequest request) {
        String scopedKey = request.getRequestKey() == null || request.getRequestKey().isBlank()
                ? null
                : InitiationIdempotencyService.scopedKey(request.getDriverId(), request.getRequestKey());
        if (scopedKey != null) {
            Optional<RaceEntryEntity> prior = idempotencyService.findPrior(scopedKey);
            if (prior.isPresent() && prior.get().getDriverId().equals(request.getDriverId())) {
                log.info("Replaying initiation for requestKey={}, paymentReference={}",
                        scopedKey, prior.get().getPaymentReference());
                return replay(prior.get());
            }
        }

        EventEntity event = loadEvent(request.getEventId());
        DriverEntity driver = loadDriver(request.getDriverId());
        requireOpen(event);
        List<EntryItem> items = canonicalItems(request.getItems());
        Quote quote = priceCalculator.quoteEntry(event, request.getRaceClass(), items, request.getDiscountCode());

        if (quote.isFreeEntry()) {
            log.info("Discount code makes entry free, routing to free entry: driverId={}, eventId={}",
                    driver.getDriverId(), event.getEventId());
            return new InitiationResult(insertFree(driver, event, request.getRaceClass(), items, quote, scopedKey), null, false);
        }
        if (quote.getTotal().signum() == 0) {
            throw new DiscountInvalidException("Discount code " + quote.getDiscountCode()
                    + " reduces the total to zero but is not a free-entry code");
        }

        PaymentReference.Race reference = PaymentReference.race(event.getEventId(), driver.getDriverId(), System.currentTimeMillis());
        GatewayForm form = gatewayAdapter.buildCheckoutForm(checkout(reference.getValue(), quote.getTotal(), driver, event, request.getRaceClass(), items));

        RaceEntryEntity entry = newEntry(driver, event, request.getRaceClass(), items, quote.getTotal(), reference.getValue());
        entry.setTeamCode(quote.getDiscountCode());
        entry.setRequestKey(scopedKey);

        StoreResult<RaceEntryEntity> stored = transactions.execute("initiate_entry", () -> {
            StoreResult<RaceEntryEntity> result = entryStore.createPendingEntry(entry);
            if (result.isCreated()) {
                entryStore.appendAudit("entry_initiated", ACTOR_DRIVER, result.getRow().getEntryId(),
                        auditDetail(result.getRow()));
            }
            return result;
        });
        RaceEntryEntity saved = stored.getRow();
        if (!stored.isCreated()) {
            return new InitiationResult(saved, form, true);
        }

        if (scopedKey != null) {
            idempotencyService.remember(scopedKey, saved.getPaymentReference());
        }
        auditLogger.logInitiation(saved.getPaymentReference(), driver.getDriverId(), event.getEventId(), saved.getAmountPaid());
        eventProducer.publishEntry("ENTRY_INITIATED", saved, ACTOR_DRIVER);
        notifications.raceEntryConfirmation(driver, event, saved);
        notifications.adminActivity("Race entry initiated", driver.getEmail(), saved.getPaymentReference());
        return new InitiationResult(saved, form, false);
    }

    /**
     * Confirm an entry whose discount code brings the total to zero. No gateway round trip.
     */
    public RaceEntryEntity completeFreeEntry(EntryRequest request) {
        EventEntity event = loadEvent(request.getEventId());
        DriverEntity driver = loadDriver(request.getDriverId());
        requireOpen(event);
        if (request.getDiscountCode() == null || request.getDiscountCode().isBlank()) {
            throw new ValidationFailedException("discountCode", "A free entry needs a discount code");
        }
        List<EntryItem> items = canonicalItems(request.getItems());
        Quote quote = priceCalculator.quoteEntry(event, request.getRaceClass(), items, request.getDiscountCode());
        if (!quote.isFreeEntry()) {
            throw new DiscountInvalidException("Discount code " + quote.getDiscountCode() + " does not make this entry free");
        }
        return insertFree(driver, event, request.getRaceClass(), items, quote, null);
    }

    /**
     * Admin entry at a chosen payment status. Ignores the registration window.
     */
    public RaceEntryEntity addManualEntry(ManualEntryRequest request) {
        PaymentStatus status = request.getPaymentStatus();
        if (status == null || status == PaymentStatus.FAILED) {
            throw new ValidationFailedException("paymentStatus", "Manual entries must be COMPLETED, FREE or PENDING");
        }
        EventEntity event = loadEvent(request.getEventId());
        DriverEntity driver = loadDriver(request.getDriverId());
        List<EntryItem> items = canonicalItems(request.getItems());
        Quote quote = priceCalculator.quoteEntry(event, request.getRaceClass(), items, request.getDiscountCode());

        String reference = PaymentReference.race(event.getEventId(), driver.getDriverId(), System.currentTimeMillis()).getValue();
        BigDecimal amount = status == PaymentStatus.FREE ? BigDecimal.ZERO : quote.getTotal();
        RaceEntryEntity entry = newEntry(driver, event, request.getRaceClass(), items, amount, reference);
        entry.setTeamCode(quote.getDiscountCode());
        String actor = request.getActor() == null ? "admin" : request.getActor();

        RaceEntryEntity saved = transactions.execute("manual_entry", () -> {
            RaceEntryEntity row;
            if (status == PaymentStatus.PENDING) {
                row = entryStore.createPendingEntry(entry).getRow();
            } else {
                entry.setPaymentStatus(status);
                row = entryStore.insertCompletedEntry(entry);
                markDriverEntered(driver.getDriverId(), items);
            }
            Map<String, Object> detail = auditDetail(row);
            detail.put("sendEmail", request.isSendEmail());
            entryStore.appendAudit("entry_manual", actor, row.getEntryId(), detail);
            return row;
        });

        auditLogger.logTransition(saved.getEntryId(), saved.getPaymentReference(), null, saved.getPaymentStatus(), actor);
        eventProducer.publishEntry("ENTRY_MANUAL", saved, actor);
        if (request.isSendEmail()) {
            notifications.raceEntryConfirmation(driver, event, saved);
        }
        return saved;
    }

    /** A driver's own entries, newest first, cancelled ones included. */
    public List<RaceEntryEntity> entriesForDriver(String driverId) {
        return entryRepository.findByDriverIdOrderByCreatedAtDesc(driverId);
    }

    private RaceEntryEntity insertFree(DriverEntity driver, EventEntity event, String raceClass,
                                       List<EntryItem> items, Quote quote, String scopedKey) {
        String reference = PaymentReference.race(event.getEventId(), driver.getDriverId(), System.currentTimeMillis()).getValue();
        RaceEntryEntity entry = newEntry(driver, event, raceClass, items, BigDecimal.ZERO, reference);
        entry.setPaymentStatus(PaymentStatus.FREE);
        entry.setTeamCode(quote.getDiscountCode());
        entry.setRequestKey(scopedKey);

        RaceEntryEntity saved = transactions.execute("free_entry", () -> {
            RaceEntryEntity row = entryStore.insertCompletedEntry(entry);
            markDriverEntered(driver.getDriverId(), items);
            entryStore.appendAudit("entry_free", ACTOR_DRIVER, row.getEntryId(), auditDetail(row));
            return row;
        });

        if (scopedKey != null) {
            idempotencyService.remember(scopedKey, saved.getPaymentReference());
        }
        auditLogger.logTransition(saved.getEntryId(), saved.getPaymentReference(), null, PaymentStatus.FREE, ACTOR_DRIVER);
        eventProducer.publishEntry("ENTRY_FREE", saved, ACTOR_DRIVER);
        notifications.raceEntryConfirmation(driver, event, saved);
        notifications.adminActivity("Free race entry", driver.getEmail(), quote.getDiscountCode());
        return saved;
    }

    /**
     * Earlier initiation with the same client key: same reference, no new mail. A fresh form is
     * signed only while the entry still awaits payment.
     */
    private InitiationResult replay(RaceEntryEntity prior) {
        if (prior.getPaymentStatus() != PaymentStatus.PENDING || prior.getEntryStatus() == EntryStatus.CANCELLED) {
            log.info("Replayed initiation for settled entry, no form issued: paymentReference={}, status={}",
                    prior.getPaymentReference(), prior.getPaymentStatus());
            return new InitiationResult(prior, null, true);
        }
        EventEntity event = loadEvent(prior.getEventId());
        DriverEntity driver = loadDriver(prior.getDriverId());
        GatewayForm form = gatewayAdapter.buildCheckoutForm(checkout(prior.getPaymentReference(), prior.getAmountPaid(),
                driver, event, prior.getRaceClass(), prior.getEntryItems()));
        return new InitiationResult(prior, form, true);
    }

    private void markDriverEntered(String driverId, List<EntryItem> items) {
        driverRepository.updateNextRaceStatus(driverId, DriverEntity.STATUS_REGISTERED,
                items.contains(EntryItem.ENGINE) ? DriverEntity.RENTAL_BOOKED : DriverEntity.RENTAL_NONE);
    }

    private RaceEntryEntity newEntry(DriverEntity driver, EventEntity event, String raceClass,
                                     List<EntryItem> items, BigDecimal amount, String reference) {
        RaceEntryEntity entry = RaceEntryEntity.builder()
                .entryId(UUID.randomUUID().toString())
                .driverId(driver.getDriverId())
                .eventId(event.getEventId())
                .raceClass(raceClass)
                .entryItems(items)
                .amountPaid(amount)
                .paymentReference(reference)
                .paymentStatus(PaymentStatus.PENDING)
                .entryStatus(EntryStatus.PENDING_PAYMENT)
                .build();
        ticketMint.mintAll(items, driver.getDriverId(), event.getEventId()).forEach(entry::setTicketRef);
        return entry;
    }

    private GatewayCheckout checkout(String reference, BigDecimal amount, DriverEntity driver, EventEntity event,
                                     String raceClass, List<EntryItem> items) {
        String itemList = items.isEmpty() ? "entry only"
                : items.stream().map(EntryItem::getLabel).collect(Collectors.joining(", "));
        return GatewayCheckout.builder()
                .paymentReference(reference)
                .amount(amount)
                .itemName("Race Entry - " + raceClass)
                .itemDescription(event.getName() + " (" + raceClass + "): " + itemList)
                .returnUrl(returnUrl)
                .cancelUrl(cancelUrl)
                .notifyUrl(notifyUrl)
                .payerEmail(driver.getEmail())
                .payerFirstName(driver.getFirstName())
                .payerLastName(driver.getLastName())
                .build();
    }

    private EventEntity loadEvent(String eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new NotFoundException("Event " + eventId + " not found"));
    }

    private DriverEntity loadDriver(String driverId) {
        return driverRepository.findById(driverId)
                .orElseThrow(() -> new NotFoundException("Driver " + driverId + " not found"));
    }

    private static void requireOpen(EventEntity event) {
        if (!event.acceptsEntries(Instant.now())) {
            throw new RegistrationClosedException("Registration for " + event.getName() + " is closed");
        }
    }

    static List<EntryItem> canonicalItems(List<String> items) {
        try {
            return EntryItem.canonicalise(items == null ? List.of() : items);
        } catch (IllegalArgumentException e) {
            throw new ValidationFailedException("items", e.getMessage());
        }
    }

    static Map<String, Object> auditDetail(RaceEntryEntity entry) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("paymentReference", entry.getPaymentReference());
        detail.put("driverId", entry.getDriverId());
        detail.put("eventId", entry.getEventId());
        detail.put("raceClass", entry.getRaceClass());
        detail.put("items", entry.getEntryItems().stream().map(EntryItem::getTag).collect(Collectors.joining(",")));
        detail.put("amount", entry.getAmountPaid());
        detail.put("paymentStatus", entry.getPaymentStatus());
        return detail;
    }
}

package com.karting.entries.core;

import com.karting.entries.api.NotFoundException;
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
import com.karting.entries.persistence.entity.FailedNotificationEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.DiscountCodeRepository;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.EventRepository;
import com.karting.entries.persistence.repository.FailedNotificationRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Operator actions on entries, events and discount codes. Callers are authenticated by the admin
 * token before reaching this service; registration windows do not apply here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryAdministration {

    private final RaceEntryRepository entryRepository;
    private final EventRepository eventRepository;
    private final DriverRepository driverRepository;
    private final DiscountCodeRepository discountCodeRepository;
    private final FailedNotificationRepository failedNotificationRepository;
    private final EntryStore entryStore;
    private final StoreTransactions transactions;
    private final TicketMint ticketMint;
    private final EntryEventProducer eventProducer;
    private final ComplianceAuditLogger auditLogger;

    /**
     * Change class, items or team code of a live entry. Added items get fresh tickets and removed
     * items lose theirs; the amount paid is not recalculated.
     */
    public RaceEntryEntity editEntry(String entryId, EntryEdit edit) {
        String actor = actorOf(edit.getActor());
        RaceEntryEntity saved = transactions.execute("edit_entry", () -> {
            RaceEntryEntity entry = loadEntry(entryId);
            if (entry.getEntryStatus() == EntryStatus.CANCELLED) {
                throw new PaymentStateMismatchException("Entry " + entryId + " is cancelled and cannot be edited");
            }
            if (edit.getRaceClass() != null) {
                if (edit.getRaceClass().isBlank()) {
                    throw new ValidationFailedException("raceClass", "Race class must not be blank");
                }
                entry.setRaceClass(edit.getRaceClass());
            }
            if (edit.getTeamCode() != null) {
                entry.setTeamCode(edit.getTeamCode().isBlank() ? null : edit.getTeamCode());
            }
            if (edit.getItems() != null) {
                List<EntryItem> items = EntryCoordinator.canonicalItems(edit.getItems());
                for (EntryItem item : EntryItem.values()) {
                    if (!items.contains(item)) {
                        entry.setTicketRef(item, null);
                    } else if (entry.getTicketRef(item) == null) {
                        entry.setTicketRef(item, ticketMint.mint(item, entry.getDriverId(), entry.getEventId()));
                    }
                }
                entry.setEntryItems(items);
            }
            RaceEntryEntity row = entryRepository.saveAndFlush(entry);
            entryStore.appendAudit("entry_edited", actor, row.getEntryId(), EntryCoordinator.auditDetail(row));
            return row;
        });
        log.info("Entry edited: entryId={}, actor={}", entryId, actor);
        eventProducer.publishEntry("ENTRY_EDITED", saved, actor);
        return saved;
    }

    /**
     * Cancel an entry. When {@code expectedStatus} is given the cancel only applies if the entry is
     * still in that payment state, so an operator cancelling a Pending entry loses to a webhook that
     * completed it first.
     *
     * @throws PaymentStateMismatchException when the entry is already cancelled or has moved on
     */
    public RaceEntryEntity cancelEntry(String entryId, PaymentStatus expectedStatus, String actorName) {
        String actor = actorOf(actorName);
        RaceEntryEntity before = loadEntry(entryId);
        PaymentStatus expected = expectedStatus != null ? expectedStatus : before.getPaymentStatus();
        if (before.getEntryStatus() == EntryStatus.CANCELLED) {
            throw new PaymentStateMismatchException("Entry " + entryId + " is already cancelled");
        }

        RaceEntryEntity cancelled = transactions.execute("cancel_entry", () -> {
            int updated = entryRepository.cancelIfStatus(entryId, expected, Instant.now(),
                    PaymentStatus.FAILED, EntryStatus.CANCELLED);
            if (updated == 0) {
                PaymentStatus current = entryRepository.findById(entryId)
                        .map(RaceEntryEntity::getPaymentStatus).orElse(null);
                throw new PaymentStateMismatchException("Entry " + entryId + " is " + current
                        + ", expected " + expected + "; not cancelled");
            }
            driverRepository.updateNextRaceStatus(before.getDriverId(),
                    DriverEntity.STATUS_NOT_REGISTERED, DriverEntity.RENTAL_NONE);
            Map<String, Object> detail = EntryCoordinator.auditDetail(before);
            detail.put("previousStatus", expected);
            entryStore.appendAudit("entry_cancelled", actor, entryId, detail);
            return entryRepository.findById(entryId).orElseThrow();
        });

        auditLogger.logTransition(entryId, cancelled.getPaymentReference(), expected, PaymentStatus.FAILED, actor);
        eventProducer.publishEntry("ENTRY_CANCELLED", cancelled, actor);
        return cancelled;
    }

    /** All entries, or those of one event in entry order. */
    public List<RaceEntryEntity> listEntries(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return entryRepository.findAllByOrderByCreatedAtDesc();
        }
        return entryRepository.findByEventIdOrderByCreatedAtAsc(eventId);
    }

    public List<FailedNotificationEntity> listFailedNotifications(int limit) {
        int size = Math.max(1, Math.min(limit, 500));
        return failedNotificationRepository.findAllByOrderByOccurredAtDesc(PageRequest.of(0, size));
    }

    public EventEntity createEvent(EventDefinition definition, String actorName) {
        if (definition.getEventId() == null || definition.getEventId().isBlank()) {
            throw new ValidationFailedException("eventId", "Event id is required");
        }
        if (!definition.getEventId().matches("[A-Za-z0-9_-]+")) {
            throw new ValidationFailedException("eventId", "Event id may contain letters, digits, '_' and '-' only");
        }
        return transactions.execute("create_event", () -> {
            if (eventRepository.existsById(definition.getEventId())) {
                throw new ValidationFailedException("eventId", "Event " + definition.getEventId() + " already exists");
            }
            EventEntity event = new EventEntity();
            event.setEventId(definition.getEventId());
            return saveEvent(event, definition, actorOf(actorName), "event_created");
        });
    }

    public EventEntity updateEvent(String eventId, EventDefinition definition, String actorName) {
        return transactions.execute("update_event", () -> {
            EventEntity event = eventRepository.findById(eventId)
                    .orElseThrow(() -> new NotFoundException("Event " + eventId + " not found"));
            return saveEvent(event, definition, actorOf(actorName), "event_updated");
        });
    }

    /** Create or replace a discount code. Codes are matched case-insensitively at pricing time. */
    public DiscountCodeEntity upsertDiscountCode(String code, DiscountType type, BigDecimal value,
                                                 String description, boolean active, String actorName) {
        if (code == null || code.isBlank()) {
            throw new ValidationFailedException("code", "Discount code is required");
        }
        if (type == null) {
            throw new ValidationFailedException("discountType", "Discount type is required");
        }
        if (type != DiscountType.FREE && (value == null || value.signum() <= 0)) {
            throw new ValidationFailedException("discountValue", "A " + type.name().toLowerCase(Locale.ROOT)
                    + " discount needs a positive value");
        }
        if (type == DiscountType.PERCENT && value.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new ValidationFailedException("discountValue", "A percent discount cannot exceed 100");
        }
        String actor = actorOf(actorName);
        return transactions.execute("upsert_discount_code", () -> {
            DiscountCodeEntity row = discountCodeRepository.findByCodeIgnoreCase(code)
                    .orElseGet(() -> DiscountCodeEntity.builder().code(code).build());
            row.setDiscountType(type);
            row.setDiscountValue(type == DiscountType.FREE ? null : value);
            row.setDescription(description);
            row.setActive(active);
            DiscountCodeEntity saved = discountCodeRepository.saveAndFlush(row);
            entryStore.appendAudit("discount_code_upserted", actor, saved.getCode(),
                    Map.of("discountType", type, "active", active));
            return saved;
        });
    }

    private EventEntity saveEvent(EventEntity event, EventDefinition definition, String actor, String action) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new ValidationFailedException("name", "Event name is required");
        }
        if (definition.getEntryFee() == null || definition.getEntryFee().signum() < 0) {
            throw new ValidationFailedException("entryFee", "Entry fee must be zero or more");
        }
        event.setName(definition.getName());
        event.setEventDate(definition.getEventDate());
        event.setVenue(definition.getVenue());
        event.setRegistrationDeadline(definition.getRegistrationDeadline());
        event.setEntryFee(definition.getEntryFee());
        event.setRegistrationOpen(definition.isRegistrationOpen());
        EventEntity saved = eventRepository.saveAndFlush(event);
        entryStore.appendAudit(action, actor, saved.getEventId(), Map.of(
                "registrationOpen", saved.isRegistrationOpen(),
                "entryFee", saved.getEntryFee(),
                "registrationDeadline", Objects.toString(saved.getRegistrationDeadline(), "none")));
        log.info("Event saved: eventId={}, action={}, registrationOpen={}", saved.getEventId(), action, saved.isRegistrationOpen());
        return saved;
    }

    private RaceEntryEntity loadEntry(String entryId) {
        return entryRepository.findById(entryId)
                .orElseThrow(() -> new NotFoundException("Entry " + entryId + " not found"));
    }

    private static String actorOf(String actor) {
        return actor == null || actor.isBlank() ? "admin" : actor;
    }
}

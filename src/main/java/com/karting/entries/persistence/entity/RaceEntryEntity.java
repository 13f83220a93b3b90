package com.karting.entries.persistence.entity;

import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One driver's entry into one event. A ticket reference column is non-null exactly
 * when its item appears in {@link #entryItems}.
 */
@Entity
@Table(name = "race_entries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_entry_driver_event_reference",
                columnNames = {"driver_id", "event_id", "payment_reference"}),
        @UniqueConstraint(name = "uq_entry_request_key", columnNames = {"request_key"})
    },
    indexes = {
        @Index(name = "idx_entry_payment_reference", columnList = "payment_reference"),
        @Index(name = "idx_entry_driver_id", columnList = "driver_id"),
        @Index(name = "idx_entry_event_id", columnList = "event_id"),
        @Index(name = "idx_entry_payment_status", columnList = "payment_status")
    })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RaceEntryEntity {

    @Id
    @Column(name = "entry_id", nullable = false)
    private String entryId;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "race_class", length = 50)
    private String raceClass;

    @Builder.Default
    @Convert(converter = EntryItemsConverter.class)
    @Column(name = "entry_items", length = 500)
    private List<EntryItem> entryItems = new ArrayList<>();

    @Column(name = "amount_paid", nullable = false, precision = 10, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "payment_reference", nullable = false)
    private String paymentReference;

    @Column(name = "pf_payment_id")
    private String pfPaymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_status", nullable = false, length = 20)
    private EntryStatus entryStatus;

    @Column(name = "ticket_engine_ref")
    private String ticketEngineRef;

    @Column(name = "ticket_tyres_ref")
    private String ticketTyresRef;

    @Column(name = "ticket_transponder_ref")
    private String ticketTransponderRef;

    @Column(name = "ticket_fuel_ref")
    private String ticketFuelRef;

    @Column(name = "team_code", length = 50)
    private String teamCode;

    /** Client idempotency key of the initiation that created this row, if any. */
    @Column(name = "request_key")
    private String requestKey;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public String getTicketRef(EntryItem item) {
        switch (item) {
            case ENGINE: return ticketEngineRef;
            case TYRES: return ticketTyresRef;
            case TRANSPONDER: return ticketTransponderRef;
            case FUEL: return ticketFuelRef;
            default: throw new IllegalArgumentException("Unknown item " + item);
        }
    }

    public void setTicketRef(EntryItem item, String ref) {
        switch (item) {
            case ENGINE: ticketEngineRef = ref; break;
            case TYRES: ticketTyresRef = ref; break;
            case TRANSPONDER: ticketTransponderRef = ref; break;
            case FUEL: ticketFuelRef = ref; break;
            default: throw new IllegalArgumentException("Unknown item " + item);
        }
    }

    public boolean hasItem(EntryItem item) {
        return entryItems != null && entryItems.contains(item);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

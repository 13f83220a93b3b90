package com.karting.entries.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A championship round. Created and edited by admins only; read-only to drivers.
 */
@Entity
@Table(name = "race_events", indexes = {
    @Index(name = "idx_event_date", columnList = "event_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventEntity {

    @Id
    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "event_date")
    private LocalDate eventDate;

    @Column(name = "venue")
    private String venue;

    @Column(name = "registration_deadline")
    private Instant registrationDeadline;

    @Column(name = "entry_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal entryFee;

    @Column(name = "registration_open", nullable = false)
    private boolean registrationOpen;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Drivers may initiate paid entries only while this holds. Admin paths ignore it. */
    public boolean acceptsEntries(Instant now) {
        return registrationOpen && (registrationDeadline == null || !now.isAfter(registrationDeadline));
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

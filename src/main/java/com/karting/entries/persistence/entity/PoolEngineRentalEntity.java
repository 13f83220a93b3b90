package com.karting.entries.persistence.entity;

import com.karting.entries.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Season-level engine rental purchase. Separate from race entries and paid under its own
 * {@code POOL-} reference namespace.
 */
@Entity
@Table(name = "pool_engine_rentals",
    uniqueConstraints = @UniqueConstraint(name = "uq_pool_rental_key",
            columnNames = {"driver_id", "championship_class", "rental_type", "season_year"}),
    indexes = @Index(name = "idx_pool_rental_reference", columnList = "payment_reference"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolEngineRentalEntity {

    @Id
    @Column(name = "rental_id", nullable = false)
    private String rentalId;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(name = "championship_class", nullable = false, length = 50)
    private String championshipClass;

    @Column(name = "rental_type", nullable = false, length = 50)
    private String rentalType;

    @Column(name = "season_year", nullable = false)
    private int seasonYear;

    @Column(name = "amount_paid", nullable = false, precision = 10, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "payment_reference", nullable = false)
    private String paymentReference;

    @Column(name = "pf_payment_id")
    private String pfPaymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

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

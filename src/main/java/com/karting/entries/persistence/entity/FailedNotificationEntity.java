package com.karting.entries.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only log of webhook deliveries whose processing failed. Operators reconcile from here.
 */
@Entity
@Table(name = "failed_notifications", indexes = {
    @Index(name = "idx_failed_notification_occurred_at", columnList = "occurred_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedNotificationEntity {

    @Id
    @Column(name = "notification_id", nullable = false)
    private String notificationId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "payment_reference")
    private String paymentReference;

    @Column(name = "error_summary", nullable = false, length = 1000)
    private String errorSummary;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "headers", columnDefinition = "TEXT")
    private String headers;

    @PrePersist
    protected void onCreate() {
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
    }
}

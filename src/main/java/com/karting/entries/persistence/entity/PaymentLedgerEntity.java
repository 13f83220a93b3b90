package com.karting.entries.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Raw record of what the gateway (or an operator standing in for it) said about a payment.
 * Insert-only: one row per (pf_payment_id, payment_status), so a PENDING notice and the later
 * COMPLETE notice for the same payment are both kept while retries of either are no-ops.
 */
@Entity
@Table(name = "payment_ledger",
    uniqueConstraints = @UniqueConstraint(name = "uq_ledger_pf_payment_status",
            columnNames = {"pf_payment_id", "payment_status"}),
    indexes = {
        @Index(name = "idx_ledger_payment_reference", columnList = "payment_reference"),
        @Index(name = "idx_ledger_created_at", columnList = "created_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentLedgerEntity {

    public static final String SOURCE_WEBHOOK = "WEBHOOK";
    public static final String SOURCE_ADMIN = "ADMIN";

    @Id
    @Column(name = "ledger_id", nullable = false)
    private String ledgerId;

    @Column(name = "pf_payment_id", nullable = false)
    private String pfPaymentId;

    @Column(name = "payment_reference")
    private String paymentReference;

    @Column(name = "amount_gross", precision = 10, scale = 2)
    private BigDecimal amountGross;

    @Column(name = "payment_status", nullable = false, length = 20)
    private String paymentStatus;

    @Column(name = "payer_email")
    private String payerEmail;

    @Column(name = "payer_first_name")
    private String payerFirstName;

    @Column(name = "payer_last_name")
    private String payerLastName;

    @Column(name = "item_name")
    private String itemName;

    @Column(name = "source", nullable = false, length = 20)
    private String source;

    @Column(name = "raw_payload", columnDefinition = "TEXT")
    private String rawPayload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}

package com.karting.entries.domain;

/**
 * Payment side of a race entry or pool rental. Paired with {@link EntryStatus}:
 * PENDING entries are always PENDING_PAYMENT, COMPLETED and FREE entries are always CONFIRMED.
 */
public enum PaymentStatus {
    /** Gateway redirect issued, no verified notification yet. */
    PENDING,
    /** Verified gateway notification (or admin reconciliation) received. */
    COMPLETED,
    /** Discount reduced the total to zero; no gateway involved. */
    FREE,
    /** Cancelled by an operator or expired before payment. */
    FAILED
}

package com.karting.entries.core;

import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.persistence.entity.PoolEngineRentalEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import lombok.Builder;
import lombok.Value;

/**
 * What reconciling one payment notification did.
 */
@Value
@Builder
public class ReconcileOutcome {

    public enum Result {
        /** Pending or cancelled entry moved to Completed. */
        ENTRY_COMPLETED,
        /** No Pending entry existed; a Completed one was synthesised from the reference. */
        LATE_ENTRY_CREATED,
        POOL_RENTAL_COMPLETED,
        /** Same payment was already applied. */
        ALREADY_APPLIED,
        /** Gateway status other than COMPLETE; ledger only. */
        NOT_COMPLETE,
        UNKNOWN_REFERENCE
    }

    Result result;
    String paymentReference;
    RaceEntryEntity entry;
    PoolEngineRentalEntity poolRental;
    /** Payment status the entry left; FAILED when a cancelled entry was confirmed by a late payment. */
    PaymentStatus previousStatus;

    public boolean isStateChanged() {
        return result == Result.ENTRY_COMPLETED
                || result == Result.LATE_ENTRY_CREATED
                || result == Result.POOL_RENTAL_COMPLETED;
    }
}

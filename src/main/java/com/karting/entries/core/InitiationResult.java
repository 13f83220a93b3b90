package com.karting.entries.core;

import com.karting.entries.domain.GatewayForm;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import lombok.Value;

/**
 * Outcome of starting an entry: either a gateway form to post, or an entry that needs no
 * payment (free, or a replay of one that is already settled).
 */
@Value
public class InitiationResult {

    RaceEntryEntity entry;
    /** Null unless the entry is still waiting for payment. */
    GatewayForm gatewayForm;
    /** True when an earlier initiation was returned instead of creating a new one. */
    boolean replayed;

    public boolean isFree() {
        return entry.getPaymentStatus() == PaymentStatus.FREE;
    }

    public boolean isAwaitingPayment() {
        return gatewayForm != null;
    }

    public String getPaymentReference() {
        return entry.getPaymentReference();
    }
}

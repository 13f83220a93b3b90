package com.karting.entries.messaging;

import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Emitted to Kafka after every committed entry or pool-rental lifecycle change.
 * Downstream consumers (results, reporting) read these instead of polling the store.
 */
@Value
@Builder
@Jacksonized
public class EntryEvent {

    String eventId;
    /** ENTRY_INITIATED, ENTRY_COMPLETED, ENTRY_FREE, ENTRY_MANUAL, ENTRY_CANCELLED, ENTRY_EDITED, POOL_RENTAL_INITIATED, POOL_RENTAL_COMPLETED */
    String eventType;
    String paymentReference;
    String entryId;
    String driverId;
    String raceEventId;
    String raceClass;
    List<String> entryItems;
    BigDecimal amount;
    PaymentStatus paymentStatus;
    EntryStatus entryStatus;
    String actor;
    Instant timestamp;
}

package com.karting.entries.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A driver's request to enter one event. Items may be tags or legacy display labels.
 */
@Value
@Builder
public class EntryRequest {

    String driverId;
    String eventId;
    String raceClass;
    @Singular
    List<String> items;
    String discountCode;
    /** Optional client idempotency key for the initiation. */
    String requestKey;
}

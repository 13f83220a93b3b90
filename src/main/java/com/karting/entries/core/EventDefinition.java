package com.karting.entries.core;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class EventDefinition {

    String eventId;
    String name;
    LocalDate eventDate;
    String venue;
    Instant registrationDeadline;
    BigDecimal entryFee;
    boolean registrationOpen;
}

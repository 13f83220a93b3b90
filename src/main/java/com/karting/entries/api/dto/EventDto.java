package com.karting.entries.api.dto;

import com.karting.entries.persistence.entity.EventEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class EventDto {

    String eventId;
    String name;
    LocalDate eventDate;
    String venue;
    Instant registrationDeadline;
    BigDecimal entryFee;
    boolean registrationOpen;
    boolean acceptingEntries;

    public static EventDto from(EventEntity event) {
        return EventDto.builder()
                .eventId(event.getEventId())
                .name(event.getName())
                .eventDate(event.getEventDate())
                .venue(event.getVenue())
                .registrationDeadline(event.getRegistrationDeadline())
                .entryFee(event.getEntryFee())
                .registrationOpen(event.isRegistrationOpen())
                .acceptingEntries(event.acceptsEntries(Instant.now()))
                .build();
    }
}

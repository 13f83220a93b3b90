package com.karting.entries.api.dto;

import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
@Builder
public class RaceEntryDto {

    String entryId;
    String driverId;
    String eventId;
    String raceClass;
    List<String> items;
    BigDecimal amountPaid;
    String paymentReference;
    PaymentStatus paymentStatus;
    EntryStatus entryStatus;
    /** Ticket reference per item tag, only for items on the entry. */
    Map<String, String> tickets;
    String teamCode;
    Instant createdAt;
    Instant completedAt;

    public static RaceEntryDto from(RaceEntryEntity entry) {
        Map<String, String> tickets = new LinkedHashMap<>();
        for (EntryItem item : EntryItem.values()) {
            String ref = entry.getTicketRef(item);
            if (ref != null) {
                tickets.put(item.getTag(), ref);
            }
        }
        return RaceEntryDto.builder()
                .entryId(entry.getEntryId())
                .driverId(entry.getDriverId())
                .eventId(entry.getEventId())
                .raceClass(entry.getRaceClass())
                .items(entry.getEntryItems().stream().map(EntryItem::getTag).collect(Collectors.toList()))
                .amountPaid(entry.getAmountPaid())
                .paymentReference(entry.getPaymentReference())
                .paymentStatus(entry.getPaymentStatus())
                .entryStatus(entry.getEntryStatus())
                .tickets(tickets)
                .teamCode(entry.getTeamCode())
                .createdAt(entry.getCreatedAt())
                .completedAt(entry.getCompletedAt())
                .build();
    }
}

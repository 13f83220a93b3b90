package com.karting.entries.messaging;

import com.karting.entries.domain.EntryItem;
import com.karting.entries.persistence.entity.PoolEngineRentalEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Publishes committed lifecycle changes, keyed by payment reference so that all events for
 * one payment land on one partition in order. Best effort: a failed send is logged only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntryEventProducer {

    private final KafkaTemplate<String, EntryEvent> kafkaTemplate;

    @Value("${karting.events.topic:race-entry-events}")
    private String topic;

    @Value("${karting.events.enabled:false}")
    private boolean enabled;

    public void publishEntry(String eventType, RaceEntryEntity entry, String actor) {
        EntryEvent event = EntryEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .paymentReference(entry.getPaymentReference())
                .entryId(entry.getEntryId())
                .driverId(entry.getDriverId())
                .raceEventId(entry.getEventId())
                .raceClass(entry.getRaceClass())
                .entryItems(tags(entry.getEntryItems()))
                .amount(entry.getAmountPaid())
                .paymentStatus(entry.getPaymentStatus())
                .entryStatus(entry.getEntryStatus())
                .actor(actor)
                .timestamp(Instant.now())
                .build();
        send(entry.getPaymentReference(), event);
    }

    public void publishPoolRental(String eventType, PoolEngineRentalEntity rental, String actor) {
        EntryEvent event = EntryEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .paymentReference(rental.getPaymentReference())
                .entryId(rental.getRentalId())
                .driverId(rental.getDriverId())
                .raceClass(rental.getChampionshipClass())
                .entryItems(List.of(EntryItem.ENGINE.getTag()))
                .amount(rental.getAmountPaid())
                .paymentStatus(rental.getPaymentStatus())
                .actor(actor)
                .timestamp(Instant.now())
                .build();
        send(rental.getPaymentReference(), event);
    }

    private void send(String key, EntryEvent event) {
        if (!enabled) {
            log.debug("Entry events disabled, not publishing eventType={} key={}", event.getEventType(), key);
            return;
        }
        log.info("Publishing entry event: key={}, eventId={}, eventType={}", key, event.getEventId(), event.getEventType());
        CompletableFuture<SendResult<String, EntryEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand entry event to Kafka key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish entry event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published entry event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }

    private static List<String> tags(List<EntryItem> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream().map(EntryItem::getTag).collect(Collectors.toList());
    }
}

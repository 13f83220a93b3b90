package com.karting.entries.api.dto;

import com.karting.entries.persistence.entity.FailedNotificationEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class FailedNotificationDto {

    String notificationId;
    Instant occurredAt;
    String paymentReference;
    String errorSummary;
    String payload;

    public static FailedNotificationDto from(FailedNotificationEntity row) {
        return FailedNotificationDto.builder()
                .notificationId(row.getNotificationId())
                .occurredAt(row.getOccurredAt())
                .paymentReference(row.getPaymentReference())
                .errorSummary(row.getErrorSummary())
                .payload(row.getPayload())
                .build();
    }
}

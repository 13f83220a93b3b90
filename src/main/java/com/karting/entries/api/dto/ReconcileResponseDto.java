package com.karting.entries.api.dto;

import com.karting.entries.core.ReconcileOutcome;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconcileResponseDto {

    String paymentReference;
    ReconcileOutcome.Result result;
    boolean stateChanged;
    RaceEntryDto entry;
    String poolRentalId;

    public static ReconcileResponseDto from(ReconcileOutcome outcome) {
        return ReconcileResponseDto.builder()
                .paymentReference(outcome.getPaymentReference())
                .result(outcome.getResult())
                .stateChanged(outcome.isStateChanged())
                .entry(outcome.getEntry() == null ? null : RaceEntryDto.from(outcome.getEntry()))
                .poolRentalId(outcome.getPoolRental() == null ? null : outcome.getPoolRental().getRentalId())
                .build();
    }
}

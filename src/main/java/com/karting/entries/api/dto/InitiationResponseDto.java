package com.karting.entries.api.dto;

import com.karting.entries.core.InitiationResult;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Either a form for the browser to POST to {@code gatewayUrl}, or no form when the entry needs
 * no payment: {@code free = true}, or a replayed entry that is already settled.
 */
@Value
@Builder
public class InitiationResponseDto {

    String paymentReference;
    boolean free;
    boolean replayed;
    String gatewayUrl;
    Map<String, String> formFields;
    RaceEntryDto entry;

    public static InitiationResponseDto from(InitiationResult result) {
        return InitiationResponseDto.builder()
                .paymentReference(result.getPaymentReference())
                .free(result.isFree())
                .replayed(result.isReplayed())
                .gatewayUrl(result.isAwaitingPayment() ? result.getGatewayForm().getGatewayUrl() : null)
                .formFields(result.isAwaitingPayment() ? result.getGatewayForm().getFields() : null)
                .entry(RaceEntryDto.from(result.getEntry()))
                .build();
    }
}

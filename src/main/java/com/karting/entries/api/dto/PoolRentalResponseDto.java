package com.karting.entries.api.dto;

import com.karting.entries.core.PoolRentalInitiation;
import com.karting.entries.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class PoolRentalResponseDto {

    String rentalId;
    String paymentReference;
    String championshipClass;
    String rentalType;
    int seasonYear;
    BigDecimal amount;
    PaymentStatus paymentStatus;
    String gatewayUrl;
    Map<String, String> formFields;

    public static PoolRentalResponseDto from(PoolRentalInitiation initiation) {
        return PoolRentalResponseDto.builder()
                .rentalId(initiation.getRental().getRentalId())
                .paymentReference(initiation.getRental().getPaymentReference())
                .championshipClass(initiation.getRental().getChampionshipClass())
                .rentalType(initiation.getRental().getRentalType())
                .seasonYear(initiation.getRental().getSeasonYear())
                .amount(initiation.getRental().getAmountPaid())
                .paymentStatus(initiation.getRental().getPaymentStatus())
                .gatewayUrl(initiation.getGatewayForm().getGatewayUrl())
                .formFields(initiation.getGatewayForm().getFields())
                .build();
    }
}

package com.karting.entries.core;

import com.karting.entries.domain.PaymentStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ManualEntryRequest {

    String driverId;
    String eventId;
    String raceClass;
    @Singular
    List<String> items;
    /** COMPLETED, FREE or PENDING. */
    PaymentStatus paymentStatus;
    String discountCode;
    boolean sendEmail;
    String actor;
}

package com.karting.entries.api.dto;

import com.karting.entries.domain.PaymentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ManualEntryRequestDto {

    @NotBlank(message = "driverId is required")
    private String driverId;

    @NotBlank(message = "eventId is required")
    private String eventId;

    @NotBlank(message = "raceClass is required")
    private String raceClass;

    private List<String> items = new ArrayList<>();

    /** COMPLETED, FREE or PENDING. */
    @NotNull(message = "paymentStatus is required")
    private PaymentStatus paymentStatus;

    private String discountCode;

    private boolean sendEmail;
}

package com.karting.entries.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
public class EventRequestDto {

    /** Required on create; ignored on update, where the path names the event. */
    @Pattern(regexp = "[A-Za-z0-9_-]+", message = "eventId may contain letters, digits, '_' and '-' only")
    private String eventId;

    @NotBlank(message = "name is required")
    private String name;

    private LocalDate eventDate;
    private String venue;
    private Instant registrationDeadline;

    @NotNull(message = "entryFee is required")
    @DecimalMin("0.00")
    private BigDecimal entryFee;

    private boolean registrationOpen;
}

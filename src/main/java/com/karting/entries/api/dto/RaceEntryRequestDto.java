package com.karting.entries.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Driver entry request. {@code items} accepts tags ({@code engine}, {@code tyres},
 * {@code transponder}, {@code fuel}) or the display labels older clients send.
 */
@Data
public class RaceEntryRequestDto {

    @NotBlank(message = "eventId is required")
    private String eventId;

    @NotBlank(message = "raceClass is required")
    @Size(max = 50)
    private String raceClass;

    private List<String> items = new ArrayList<>();

    @Size(max = 50)
    private String discountCode;

    /** Optional client key; repeating it returns the first initiation. */
    @Size(max = 100)
    private String requestKey;
}

package com.karting.entries.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class PoolRentalRequestDto {

    @NotBlank(message = "championshipClass is required")
    @Size(max = 50)
    private String championshipClass;

    @NotBlank(message = "rentalType is required")
    @Size(max = 50)
    private String rentalType;
}

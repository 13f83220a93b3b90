package com.karting.entries.api.dto;

import com.karting.entries.domain.DiscountType;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class DiscountCodeRequestDto {

    @NotNull(message = "discountType is required")
    private DiscountType discountType;

    /** Percent or rand amount; ignored for FREE codes. */
    private BigDecimal discountValue;

    private String description;

    private boolean active = true;
}

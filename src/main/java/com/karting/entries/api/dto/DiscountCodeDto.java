package com.karting.entries.api.dto;

import com.karting.entries.domain.DiscountType;
import com.karting.entries.persistence.entity.DiscountCodeEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DiscountCodeDto {

    String code;
    String description;
    DiscountType discountType;
    BigDecimal discountValue;
    boolean active;

    public static DiscountCodeDto from(DiscountCodeEntity row) {
        return DiscountCodeDto.builder()
                .code(row.getCode())
                .description(row.getDescription())
                .discountType(row.getDiscountType())
                .discountValue(row.getDiscountValue())
                .active(row.isActive())
                .build();
    }
}

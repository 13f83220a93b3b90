package com.karting.entries.core;

import com.karting.entries.domain.DiscountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Quote {

    BigDecimal baseFee;
    BigDecimal itemsTotal;
    BigDecimal discount;
    BigDecimal total;
    /** Normalised code that was applied, or null. */
    String discountCode;
    DiscountType discountType;

    /** Zero total reached through a free-type code: no gateway round trip. */
    public boolean isFreeEntry() {
        return discountType == DiscountType.FREE && total.signum() == 0;
    }
}

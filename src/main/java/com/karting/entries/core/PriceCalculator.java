package com.karting.entries.core;

import com.karting.entries.api.DiscountInvalidException;
import com.karting.entries.api.ValidationFailedException;
import com.karting.entries.config.PricingProperties;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.persistence.entity.DiscountCodeEntity;
import com.karting.entries.persistence.entity.EventEntity;
import com.karting.entries.persistence.repository.DiscountCodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Prices race entries and season pool rentals from {@link PricingProperties} and active
 * discount codes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PricingProperties pricing;
    private final DiscountCodeRepository discountCodeRepository;

    public Quote quoteEntry(EventEntity event, String raceClass, List<EntryItem> items, String discountCode) {
        BigDecimal base = pricing.getClassFees().get(raceClass);
        if (base == null) {
            base = event.getEntryFee();
        }
        if (base == null) {
            throw new ValidationFailedException("raceClass", "No entry fee configured for class " + raceClass);
        }

        BigDecimal itemsTotal = BigDecimal.ZERO;
        for (EntryItem item : items) {
            BigDecimal price = pricing.getItems().get(item.getTag());
            if (price == null) {
                throw new ValidationFailedException("items", "No price configured for item " + item.getTag());
            }
            itemsTotal = itemsTotal.add(price);
        }
        BigDecimal subtotal = base.add(itemsTotal);

        Optional<DiscountCodeEntity> discount = resolveDiscount(discountCode);
        BigDecimal reduction = discount.map(d -> reduction(d, subtotal)).orElse(BigDecimal.ZERO);
        BigDecimal total = subtotal.subtract(reduction).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);

        log.debug("Quoted entry: eventId={}, class={}, items={}, subtotal={}, discount={}, total={}",
                event.getEventId(), raceClass, items, subtotal, reduction, total);
        return Quote.builder()
                .baseFee(base)
                .itemsTotal(itemsTotal)
                .discount(reduction)
                .total(total)
                .discountCode(discount.map(DiscountCodeEntity::getCode).orElse(null))
                .discountType(discount.map(DiscountCodeEntity::getDiscountType).orElse(null))
                .build();
    }

    public BigDecimal quotePoolRental(String rentalType) {
        BigDecimal price = pricing.getPoolRentals().get(rentalType);
        if (price == null) {
            throw new ValidationFailedException("rentalType", "Unknown pool rental type " + rentalType);
        }
        return price.setScale(2, RoundingMode.HALF_UP);
    }

    /** Blank means no code. A code that is given must exist and be active. */
    Optional<DiscountCodeEntity> resolveDiscount(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        DiscountCodeEntity discount = discountCodeRepository.findByCodeIgnoreCase(code.trim())
                .orElseThrow(() -> new DiscountInvalidException("Discount code " + code.trim() + " does not exist"));
        if (!discount.isActive()) {
            throw new DiscountInvalidException("Discount code " + discount.getCode() + " is not active");
        }
        return Optional.of(discount);
    }

    private static BigDecimal reduction(DiscountCodeEntity discount, BigDecimal subtotal) {
        BigDecimal value = discount.getDiscountValue() == null ? BigDecimal.ZERO : discount.getDiscountValue();
        switch (discount.getDiscountType()) {
            case FREE:
                return subtotal;
            case PERCENT:
                return subtotal.multiply(value).divide(HUNDRED, 2, RoundingMode.HALF_UP).min(subtotal);
            case FIXED:
                return value.min(subtotal);
            default:
                throw new IllegalStateException("Unhandled discount type " + discount.getDiscountType());
        }
    }
}

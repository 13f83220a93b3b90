package com.karting.entries.domain;

/**
 * How a discount code reduces an entry total.
 */
public enum DiscountType {
    /** discount_value is a percentage of the total. */
    PERCENT,
    /** discount_value is subtracted from the total, floored at zero. */
    FIXED,
    /** Total becomes zero regardless of discount_value. */
    FREE
}

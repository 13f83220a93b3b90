package com.karting.entries.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Price table under {@code karting.pricing}. Amounts are in Rand.
 */
@Data
@ConfigurationProperties(prefix = "karting.pricing")
public class PricingProperties {

    /** Per-class entry fee. Classes not listed pay the event's own entry fee. */
    private Map<String, BigDecimal> classFees = new LinkedHashMap<>();

    /** Per-item rental price, keyed by item tag (engine, tyres, transponder, fuel). */
    private Map<String, BigDecimal> items = new LinkedHashMap<>();

    /** Season pool-engine rental price, keyed by rental type. */
    private Map<String, BigDecimal> poolRentals = new LinkedHashMap<>();
}

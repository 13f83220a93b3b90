package com.karting.entries.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Optional rentable items on a race entry. Each item has a stable tag (stored in
 * {@code entry_items}) and the ticket prefix printed on its barcode.
 */
public enum EntryItem {

    ENGINE("engine", "ENG", "Engine Rental"),
    TYRES("tyres", "TYR", "Tyres"),
    TRANSPONDER("transponder", "TRS", "Transponder Rental"),
    FUEL("fuel", "FUEL", "Controlled Fuel");

    private final String tag;
    private final String ticketPrefix;
    private final String label;

    EntryItem(String tag, String ticketPrefix, String label) {
        this.tag = tag;
        this.ticketPrefix = ticketPrefix;
        this.label = label;
    }

    public String getTag() {
        return tag;
    }

    public String getTicketPrefix() {
        return ticketPrefix;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a stable tag or a legacy display label ("Engine Rental", "Tyres (Optional)",
     * "Controlled Fuel") to an item.
     */
    public static Optional<EntryItem> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (EntryItem item : values()) {
            if (item.tag.equals(normalized)) {
                return Optional.of(item);
            }
        }
        if (normalized.contains("engine")) return Optional.of(ENGINE);
        if (normalized.contains("tyre") || normalized.contains("tire")) return Optional.of(TYRES);
        if (normalized.contains("transponder")) return Optional.of(TRANSPONDER);
        if (normalized.contains("fuel")) return Optional.of(FUEL);
        return Optional.empty();
    }

    /**
     * Canonical, de-duplicated item list in selection order.
     *
     * @throws IllegalArgumentException when a value names no known item
     */
    public static List<EntryItem> canonicalise(Collection<String> selection) {
        if (selection == null || selection.isEmpty()) {
            return List.of();
        }
        Set<EntryItem> items = new LinkedHashSet<>();
        for (String value : selection) {
            items.add(fromText(value)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown entry item: " + value)));
        }
        return List.copyOf(items);
    }
}

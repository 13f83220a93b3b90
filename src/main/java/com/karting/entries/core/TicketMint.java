package com.karting.entries.core;

import com.karting.entries.domain.EntryItem;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mints ticket references of the form {@code ENG-DRIVERID-EVENTID-1700000000000-X4K9QZ}.
 * <p>
 * The millisecond component never repeats within a process and the six base-36 random characters
 * (about 31 bits) separate processes, so uniqueness is not checked against the store.
 * Output only contains Code 39 characters: upper-case letters, digits and hyphens.
 */
@Component
public class TicketMint {

    private static final int PARTY_PREFIX_LENGTH = 8;
    private static final int RANDOM_LENGTH = 6;
    private static final char[] ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();

    private final SecureRandom random = new SecureRandom();
    private final AtomicLong lastMillis = new AtomicLong();

    public String mint(EntryItem item, String driverId, String eventId) {
        return item.getTicketPrefix()
                + "-" + partyPrefix(driverId)
                + "-" + partyPrefix(eventId)
                + "-" + nextMillis()
                + "-" + randomSuffix();
    }

    /** One reference per selected item, in item order. */
    public Map<EntryItem, String> mintAll(Collection<EntryItem> items, String driverId, String eventId) {
        Map<EntryItem, String> refs = new EnumMap<>(EntryItem.class);
        for (EntryItem item : items) {
            refs.put(item, mint(item, driverId, eventId));
        }
        return refs;
    }

    private long nextMillis() {
        return lastMillis.updateAndGet(last -> Math.max(System.currentTimeMillis(), last + 1));
    }

    private String randomSuffix() {
        char[] chars = new char[RANDOM_LENGTH];
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            chars[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(chars);
    }

    static String partyPrefix(String id) {
        String cleaned = id == null ? "" : id.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
        if (cleaned.isEmpty()) {
            return "X";
        }
        return cleaned.length() > PARTY_PREFIX_LENGTH ? cleaned.substring(0, PARTY_PREFIX_LENGTH) : cleaned;
    }
}

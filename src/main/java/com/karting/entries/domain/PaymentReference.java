package com.karting.entries.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Correlator handed to the gateway and echoed back on the webhook.
 *
 * <pre>
 *   RACE-{eventId}-{driverId}-{epochMillis}
 *   POOL-{classTag}-{rentalType}-{driverId}-{epochMillis}
 * </pre>
 *
 * Identifiers issued elsewhere may themselves contain hyphens ({@code E-RED}, {@code D-001}), so a
 * parsed race reference keeps every possible event/driver split and lets the caller resolve
 * them against known records.
 */
@Getter
@EqualsAndHashCode(of = "value")
public abstract class PaymentReference {

    public static final String RACE_PREFIX = "RACE";
    public static final String POOL_PREFIX = "POOL";

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern TIMESTAMP = Pattern.compile("\\d{10,15}");

    public enum Kind { RACE, POOL, UNKNOWN }

    private final String value;

    protected PaymentReference(String value) {
        this.value = value;
    }

    public abstract Kind getKind();

    @Override
    public String toString() {
        return value;
    }

    public static Race race(String eventId, String driverId, long epochMillis) {
        String value = RACE_PREFIX + "-" + eventId + "-" + driverId + "-" + epochMillis;
        return new Race(value, List.of(new RaceParties(eventId, driverId)), epochMillis);
    }

    public static Pool pool(String championshipClass, String rentalType, String driverId, long epochMillis) {
        String classTag = toTag(championshipClass);
        String typeTag = toTag(rentalType);
        String value = POOL_PREFIX + "-" + classTag + "-" + typeTag + "-" + driverId + "-" + epochMillis;
        return new Pool(value, classTag, typeTag, driverId, epochMillis);
    }

    /**
     * Reduces free text to the reference alphabet: anything outside {@code [A-Za-z0-9_]} becomes
     * an underscore. {@code "OK-J"} becomes {@code "OK_J"}.
     */
    public static String toTag(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Reference segment must not be blank");
        }
        return text.trim().replaceAll("[^A-Za-z0-9_]", "_");
    }

    /** Never throws; anything that does not match a known grammar is {@link Unknown}. */
    public static PaymentReference parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new Unknown(raw == null ? "" : raw);
        }
        String value = raw.trim();
        String[] parts = value.split("-", -1);
        if (parts.length < 2 || !allSegmentsValid(parts)) {
            return new Unknown(value);
        }
        String last = parts[parts.length - 1];
        if (!TIMESTAMP.matcher(last).matches()) {
            return new Unknown(value);
        }
        long epochMillis = Long.parseLong(last);

        if (RACE_PREFIX.equals(parts[0]) && parts.length >= 4) {
            // parts[1 .. n-2] hold eventId and driverId joined by '-'
            String[] middle = Arrays.copyOfRange(parts, 1, parts.length - 1);
            List<RaceParties> candidates = new ArrayList<>();
            for (int split = 1; split < middle.length; split++) {
                candidates.add(new RaceParties(
                        String.join("-", Arrays.copyOfRange(middle, 0, split)),
                        String.join("-", Arrays.copyOfRange(middle, split, middle.length))));
            }
            return new Race(value, candidates, epochMillis);
        }
        if (POOL_PREFIX.equals(parts[0]) && parts.length >= 5) {
            String driverId = String.join("-", Arrays.copyOfRange(parts, 3, parts.length - 1));
            return new Pool(value, parts[1], parts[2], driverId, epochMillis);
        }
        return new Unknown(value);
    }

    private static boolean allSegmentsValid(String[] parts) {
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                return false;
            }
        }
        return true;
    }

    /** One way of reading the event and driver identifiers out of a race reference. */
    @lombok.Value
    public static class RaceParties {
        String eventId;
        String driverId;
    }

    @Getter
    public static final class Race extends PaymentReference {

        private final List<RaceParties> candidates;
        private final long epochMillis;

        private Race(String value, List<RaceParties> candidates, long epochMillis) {
            super(value);
            this.candidates = Collections.unmodifiableList(candidates);
            this.epochMillis = epochMillis;
        }

        @Override
        public Kind getKind() {
            return Kind.RACE;
        }

        public boolean isAmbiguous() {
            return candidates.size() > 1;
        }

        /** The split to use when nothing better is known: event id before the first hyphen. */
        public RaceParties getPrimary() {
            return candidates.get(0);
        }
    }

    @Getter
    public static final class Pool extends PaymentReference {

        private final String classTag;
        private final String rentalType;
        private final String driverId;
        private final long epochMillis;

        private Pool(String value, String classTag, String rentalType, String driverId, long epochMillis) {
            super(value);
            this.classTag = classTag;
            this.rentalType = rentalType;
            this.driverId = driverId;
            this.epochMillis = epochMillis;
        }

        @Override
        public Kind getKind() {
            return Kind.POOL;
        }
    }

    public static final class Unknown extends PaymentReference {

        private Unknown(String value) {
            super(value);
        }

        @Override
        public Kind getKind() {
            return Kind.UNKNOWN;
        }
    }
}

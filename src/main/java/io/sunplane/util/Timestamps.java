package io.sunplane.util;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * RFC 3339 timestamps at second precision in UTC, the format every stored document uses.
 */
public final class Timestamps {
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    public static String compact(Instant instant) {
        return COMPACT.format(instant);
    }

    public static String day(Instant instant) {
        return DAY.format(instant);
    }

    /**
     * Returns null when the value is blank or not a valid RFC 3339 timestamp.
     */
    public static Instant parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Sort key where unparseable values order before every real timestamp.
     */
    public static Instant sortKey(String raw) {
        Instant parsed = parseOrNull(raw);
        return parsed == null ? Instant.MIN : parsed;
    }
}

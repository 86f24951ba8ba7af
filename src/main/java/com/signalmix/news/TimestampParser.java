package com.signalmix.news;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Tolerant timestamp parsing for news feeds. Zone-less values are read as UTC.
 */
public final class TimestampParser {
    private static final Pattern EPOCH = Pattern.compile("^\\d{9,13}$");
    private static final Pattern SPACED_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}.*$");
    private static final long EPOCH_MILLIS_MIN = 100_000_000_000L;

    private TimestampParser() {
    }

    /**
     * @return the instant, or null when no supported layout matches
     */
    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        if (EPOCH.matcher(text).matches()) {
            long value = Long.parseLong(text);
            return value >= EPOCH_MILLIS_MIN ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
        }
        if (SPACED_DATE_TIME.matcher(text).matches()) {
            text = text.substring(0, 10) + "T" + text.substring(11).replace(" ", "");
        }

        Instant parsed = tryInstant(text);
        if (parsed == null) {
            parsed = tryOffset(text);
        }
        if (parsed == null) {
            parsed = tryZoned(text);
        }
        if (parsed == null) {
            parsed = tryLocalDateTime(text);
        }
        if (parsed == null) {
            parsed = tryRfc1123(text);
        }
        if (parsed == null) {
            parsed = tryLocalDate(text);
        }
        return parsed;
    }

    private static Instant tryInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static Instant tryOffset(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static Instant tryZoned(String text) {
        try {
            return ZonedDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static Instant tryLocalDateTime(String text) {
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static Instant tryRfc1123(String text) {
        try {
            return ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static Instant tryLocalDate(String text) {
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}

package com.clinic.booking.availability;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parsing and formatting of wire timestamps in the clinic's time zone.
 */
public final class ClinicTime {

    public static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("HH:mm");

    private ClinicTime() {
    }

    public static Optional<LocalDate> parseDate(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Accepts an ISO-8601 timestamp with offset, or a local date-time read in {@code zone}.
     */
    public static Optional<Instant> parseTimestamp(String raw, ZoneId zone) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        String text = raw.trim();
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // fall through to local date-time
        }
        try {
            return Optional.of(LocalDateTime.parse(text).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String format(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public static String format(LocalDateTime local, ZoneId zone) {
        return local.atZone(zone).toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public static String hourMinute(LocalTime time) {
        return time.format(HOUR_MINUTE);
    }
}

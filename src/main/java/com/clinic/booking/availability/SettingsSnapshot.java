package com.clinic.booking.availability;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Immutable view of the booking settings, taken once per request and passed
 * explicitly into every resolver call.
 */
public record SettingsSnapshot(int cutoffDays,
                               int cutoffHours,
                               int maxDaysAhead,
                               int slotDurationMinutes,
                               int defaultSlotCapacity,
                               LocalTime lunchStart,
                               LocalTime lunchEnd) {

    public static final String KEY_CUTOFF_DAYS = "booking_cutoff_days";
    public static final String KEY_CUTOFF_HOURS = "booking_cutoff_hours";
    public static final String KEY_MAX_DAYS_AHEAD = "booking_max_days_ahead";
    public static final String KEY_SLOT_DURATION = "slot_duration_minutes";
    public static final String KEY_DEFAULT_CAPACITY = "default_slot_capacity";
    public static final String KEY_LUNCH_START = "lunch_start";
    public static final String KEY_LUNCH_END = "lunch_end";

    public static final int DEFAULT_CUTOFF_DAYS = 2;
    public static final int DEFAULT_CUTOFF_HOURS = 3;
    public static final int DEFAULT_MAX_DAYS_AHEAD = 60;
    public static final int DEFAULT_SLOT_DURATION = 30;
    public static final int DEFAULT_CAPACITY = 1;
    public static final LocalTime DEFAULT_LUNCH_START = LocalTime.of(12, 0);
    public static final LocalTime DEFAULT_LUNCH_END = LocalTime.of(13, 0);

    public static SettingsSnapshot defaults() {
        return new SettingsSnapshot(DEFAULT_CUTOFF_DAYS, DEFAULT_CUTOFF_HOURS, DEFAULT_MAX_DAYS_AHEAD,
                DEFAULT_SLOT_DURATION, DEFAULT_CAPACITY, DEFAULT_LUNCH_START, DEFAULT_LUNCH_END);
    }

    /**
     * Reads a key/value settings map. Absent, non-numeric or out-of-range values
     * fall back to the defaults.
     */
    public static SettingsSnapshot fromMap(Map<String, String> values) {
        Map<String, String> v = values == null ? Map.of() : values;
        return new SettingsSnapshot(
                intValue(v.get(KEY_CUTOFF_DAYS), DEFAULT_CUTOFF_DAYS, 0, 365),
                intValue(v.get(KEY_CUTOFF_HOURS), DEFAULT_CUTOFF_HOURS, 0, 24),
                intValue(v.get(KEY_MAX_DAYS_AHEAD), DEFAULT_MAX_DAYS_AHEAD, 0, 3650),
                intValue(v.get(KEY_SLOT_DURATION), DEFAULT_SLOT_DURATION, 1, 1440),
                intValue(v.get(KEY_DEFAULT_CAPACITY), DEFAULT_CAPACITY, 1, Integer.MAX_VALUE),
                timeValue(v.get(KEY_LUNCH_START), DEFAULT_LUNCH_START),
                timeValue(v.get(KEY_LUNCH_END), DEFAULT_LUNCH_END));
    }

    /**
     * Last instant at which bookings for {@code date} are still accepted:
     * {@code cutoffDays} before the date, at {@code 24 - cutoffHours} o'clock.
     */
    public Instant cutoffInstant(LocalDate date, ZoneId zone) {
        return date.minusDays(cutoffDays)
                .atStartOfDay(zone)
                .plusHours(24L - cutoffHours)
                .toInstant();
    }

    public LocalDate lastBookableDate(LocalDate today) {
        return today.plusDays(maxDaysAhead);
    }

    /**
     * Horizon and cutoff check shared by slot search, booking validation and the
     * date picker.
     *
     * @return the rejection message, or null when {@code date} is still bookable at {@code now}
     */
    public String bookingWindowError(LocalDate date, Instant now, ZoneId zone) {
        LocalDate today = now.atZone(zone).toLocalDate();
        if (date.isAfter(lastBookableDate(today))) {
            return horizonMessage();
        }
        if (now.isAfter(cutoffInstant(date, zone))) {
            return cutoffMessage();
        }
        return null;
    }

    public String horizonMessage() {
        return "Bookings can only be made up to " + maxDaysAhead + " days ahead";
    }

    public String cutoffMessage() {
        return String.format("Booking for this date has closed (%d days before, %02d:00)",
                cutoffDays, 24 - cutoffHours);
    }

    private static int intValue(String raw, int fallback, int min, int max) {
        if (StringUtils.isBlank(raw)) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed < min || parsed > max ? fallback : parsed;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static LocalTime timeValue(String raw, LocalTime fallback) {
        if (StringUtils.isBlank(raw)) {
            return fallback;
        }
        try {
            return LocalTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
}

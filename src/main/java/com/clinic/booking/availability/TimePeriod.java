package com.clinic.booking.availability;

import java.time.LocalTime;

/**
 * Half-open time-of-day range [open, close).
 */
public record TimePeriod(LocalTime open, LocalTime close) {

    public TimePeriod {
        if (open == null || close == null) {
            throw new IllegalArgumentException("open and close are required");
        }
        if (!close.isAfter(open)) {
            throw new IllegalArgumentException("close must be after open: " + open + "-" + close);
        }
    }

    /**
     * Builds a period from a nullable pair; returns null unless both ends are set and ordered.
     */
    public static TimePeriod ofNullable(LocalTime open, LocalTime close) {
        if (open == null || close == null || !close.isAfter(open)) {
            return null;
        }
        return new TimePeriod(open, close);
    }

    public boolean overlaps(LocalTime start, LocalTime end) {
        return start.isBefore(close) && end.isAfter(open);
    }

    public boolean contains(LocalTime start, LocalTime end) {
        return !start.isBefore(open) && !end.isAfter(close);
    }
}

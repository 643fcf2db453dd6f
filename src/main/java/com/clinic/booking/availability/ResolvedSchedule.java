package com.clinic.booking.availability;

import com.clinic.booking.entity.ScheduleExceptionType;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Effective opening of one calendar date after holidays, schedule exceptions
 * and weekly hours have been merged.
 *
 * @param blockedRange partial-closure range to filter slots with, or null
 * @param appliedException the winning exception type, or null when weekly hours apply as-is
 */
public record ResolvedSchedule(LocalDate date,
                               boolean open,
                               List<TimePeriod> periods,
                               String closureReason,
                               TimePeriod blockedRange,
                               ScheduleExceptionType appliedException) {

    public ResolvedSchedule {
        periods = periods == null ? List.of() : List.copyOf(periods);
    }

    public static ResolvedSchedule closed(LocalDate date, String reason, ScheduleExceptionType appliedException) {
        return new ResolvedSchedule(date, false, List.of(), reason, null, appliedException);
    }

    public boolean isBlocked(LocalTime start, LocalTime end) {
        return blockedRange != null && blockedRange.overlaps(start, end);
    }

    /**
     * Floors {@code time} onto the slot grid that starts at the open time of the
     * period containing it, so an off-grid start maps to the slot it falls in.
     * Outside every period the grid is anchored at midnight.
     */
    public LocalTime gridTimeAt(LocalTime time, int stepMinutes) {
        int step = Math.max(1, stepMinutes);
        LocalTime anchor = periods.stream()
                .filter(p -> !time.isBefore(p.open()) && time.isBefore(p.close()))
                .map(TimePeriod::open)
                .findFirst()
                .orElse(LocalTime.MIDNIGHT);
        long offset = Duration.between(anchor, time).toMinutes();
        return anchor.plusMinutes(offset - offset % step);
    }
}

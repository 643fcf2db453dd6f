package com.clinic.booking.availability;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Capacity lookup for one calendar date, built from the weekday rows and the
 * date-specific rows loaded once.
 */
public final class DayCapacity {

    public static final String SOURCE_DEFAULT = "default";
    public static final String SOURCE_DAY = "day";
    public static final String SOURCE_DATE = "date";

    private final Map<LocalTime, Integer> dateRows;
    private final Map<LocalTime, Integer> dayRows;
    private final int defaultCapacity;

    DayCapacity(Map<LocalTime, Integer> dateRows, Map<LocalTime, Integer> dayRows, int defaultCapacity) {
        this.dateRows = Map.copyOf(dateRows);
        this.dayRows = Map.copyOf(dayRows);
        this.defaultCapacity = Math.max(1, defaultCapacity);
    }

    public int capacityAt(LocalTime time) {
        LocalTime key = normalize(time);
        Integer value = dateRows.get(key);
        if (value == null) {
            value = dayRows.get(key);
        }
        return value == null ? defaultCapacity : Math.max(1, value);
    }

    public String sourceAt(LocalTime time) {
        LocalTime key = normalize(time);
        if (dateRows.containsKey(key)) return SOURCE_DATE;
        if (dayRows.containsKey(key)) return SOURCE_DAY;
        return SOURCE_DEFAULT;
    }

    public int defaultCapacity() {
        return defaultCapacity;
    }

    static LocalTime normalize(LocalTime time) {
        return time.truncatedTo(ChronoUnit.MINUTES);
    }
}

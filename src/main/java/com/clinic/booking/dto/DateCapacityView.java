package com.clinic.booking.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Effective capacity per generated time of day on one date, with the layer it came from.
 */
public record DateCapacityView(LocalDate date, int dayOfWeek, int defaultCapacity, List<Entry> capacities) {

    public record Entry(String timeSlot, int capacity, String source) {
    }
}

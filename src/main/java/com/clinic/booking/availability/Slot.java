package com.clinic.booking.availability;

/**
 * One candidate booking window.
 *
 * @param start clinic-local "HH:mm"
 * @param startAt ISO-8601 timestamp with the clinic offset
 */
public record Slot(String start,
                   String end,
                   String startAt,
                   String endAt,
                   boolean available,
                   int bookingCount,
                   int capacity) {
}

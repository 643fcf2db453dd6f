package com.clinic.booking.availability;

import java.time.LocalDate;

/**
 * A date offered by the calendar picker.
 *
 * @param dayOfWeek 0 = Sunday, 6 = Saturday
 * @param dayName short English weekday name
 */
public record AvailableDate(LocalDate date, int dayOfWeek, String dayName, boolean hasException) {
}

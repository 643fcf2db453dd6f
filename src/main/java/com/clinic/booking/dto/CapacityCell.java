package com.clinic.booking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalTime;

/**
 * One cell of a capacity grid. A null {@code capacity} removes the override.
 *
 * @param dayOfWeek 0 = Sunday; ignored for date-specific cells
 */
public record CapacityCell(Integer dayOfWeek,
                           @JsonFormat(pattern = "HH:mm") LocalTime timeSlot,
                           Integer capacity) {
}

package com.clinic.booking.dto;

import jakarta.validation.constraints.Min;

/**
 * Body of single-cell capacity updates. A null value resets the cell.
 */
public record CapacityValue(@Min(1) Integer capacity) {
}

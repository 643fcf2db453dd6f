package com.clinic.booking.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Partial update; null fields keep their stored value.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingSettingsRequest {

    @Min(0)
    @Max(365)
    private Integer cutoffDays;

    @Min(0)
    @Max(24)
    private Integer cutoffHours;

    @Min(0)
    @Max(3650)
    private Integer maxDaysAhead;

    @Min(1)
    @Max(1440)
    private Integer slotDurationMinutes;

    @Min(1)
    private Integer defaultSlotCapacity;
}

package com.clinic.booking.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Create or partial update of a menu entry; null fields are left unchanged on update.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClinicServiceRequest {

    @Size(max = 255)
    private String name;

    private String description;

    @Min(value = 1, message = "durationMinutes must be 1 or more")
    private Integer durationMinutes;

    private Boolean active;
}

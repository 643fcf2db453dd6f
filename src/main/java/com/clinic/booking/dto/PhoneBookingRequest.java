package com.clinic.booking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Booking taken by reception staff over the phone. The end time is derived from
 * the service duration; phone and kana may be left empty.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PhoneBookingRequest {

    @NotBlank(message = "name is required")
    @Size(max = 100)
    private String name;

    @NotBlank(message = "startAt is required")
    private String startAt;

    @NotNull(message = "serviceId is required")
    private Long serviceId;

    private Long staffId;

    private String kana;

    private String phone;

    private String notes;
}

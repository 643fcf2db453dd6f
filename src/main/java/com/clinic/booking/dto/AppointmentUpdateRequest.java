package com.clinic.booking.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentUpdateRequest {

    /** confirmed, cancelled or completed; null leaves the status unchanged. */
    private String status;

    /** Null leaves the notes unchanged, an empty string clears them. */
    private String notes;
}

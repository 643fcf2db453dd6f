package com.clinic.booking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StaffRequest {

    @NotBlank(message = "name is required")
    @Size(max = 255)
    private String name;

    @Size(max = 255)
    private String title;
}

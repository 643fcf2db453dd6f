package com.clinic.booking.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentRequest {

    @NotNull(message = "serviceId is required")
    private Long serviceId;

    private Long staffId;

    @NotBlank(message = "startAt is required")
    private String startAt;

    @NotBlank(message = "endAt is required")
    private String endAt;

    @NotBlank(message = "name is required")
    @Size(max = 100)
    private String name;

    @NotBlank(message = "kana is required")
    @Size(max = 100)
    private String kana;

    @NotBlank(message = "phone is required")
    private String phone;

    @Email(message = "email must be a valid address")
    private String email;

    @Size(max = 255)
    private String address;
}

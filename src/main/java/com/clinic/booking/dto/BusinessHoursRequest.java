package com.clinic.booking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusinessHoursRequest {

    private boolean closed;
    private LocalTime morningOpen;
    private LocalTime morningClose;
    private LocalTime afternoonOpen;
    private LocalTime afternoonClose;
}

package com.clinic.booking.dto;

import com.clinic.booking.entity.ScheduleExceptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleExceptionRequest {

    @NotNull(message = "type is required")
    private ScheduleExceptionType type;

    @NotNull(message = "startDate is required")
    private LocalDate startDate;

    @NotNull(message = "endDate is required")
    private LocalDate endDate;

    private LocalTime startTime;
    private LocalTime endTime;
    private LocalTime morningOpen;
    private LocalTime morningClose;
    private LocalTime afternoonOpen;
    private LocalTime afternoonClose;

    @Size(max = 255)
    private String reason;

    private String notes;

    private boolean recurring;
}

package com.clinic.booking.controller;

import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.dto.BusinessHoursRequest;
import com.clinic.booking.dto.HolidayRequest;
import com.clinic.booking.dto.ScheduleExceptionRequest;
import com.clinic.booking.entity.BusinessHours;
import com.clinic.booking.entity.Holiday;
import com.clinic.booking.entity.ScheduleException;
import com.clinic.booking.entity.ScheduleExceptionType;
import com.clinic.booking.service.ScheduleAdminService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

/**
 * Weekly hours, holidays and schedule exceptions.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminScheduleController {

    private final ScheduleAdminService scheduleAdminService;

    public AdminScheduleController(ScheduleAdminService scheduleAdminService) {
        this.scheduleAdminService = scheduleAdminService;
    }

    @GetMapping("/business-hours")
    public List<BusinessHours> businessHours() {
        return scheduleAdminService.listBusinessHours();
    }

    @PutMapping("/business-hours/{dayOfWeek}")
    public BusinessHours updateBusinessHours(@PathVariable int dayOfWeek, @RequestBody BusinessHoursRequest request) {
        return scheduleAdminService.updateBusinessHours(dayOfWeek, request);
    }

    @GetMapping("/holidays")
    public List<Holiday> holidays() {
        return scheduleAdminService.listHolidays();
    }

    @PostMapping("/holidays")
    @ResponseStatus(HttpStatus.CREATED)
    public Holiday createHoliday(@Valid @RequestBody HolidayRequest request) {
        return scheduleAdminService.createHoliday(request);
    }

    @DeleteMapping("/holidays/{id}")
    public Map<String, Object> deleteHoliday(@PathVariable Long id) {
        scheduleAdminService.deleteHoliday(id);
        return Map.of("success", true);
    }

    @GetMapping("/schedule-exceptions")
    public List<ScheduleException> exceptions(@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
                                              @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
                                              @RequestParam(required = false) String type) {
        ScheduleExceptionType parsed = type == null || type.isBlank() ? null : ScheduleExceptionType.fromValue(type);
        return scheduleAdminService.listExceptions(start, end, parsed);
    }

    @GetMapping("/schedule-exceptions/affected-appointments")
    public List<AppointmentView> affectedAppointments(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime startTime,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime endTime) {
        return scheduleAdminService.affectedAppointments(startDate, endDate, startTime, endTime);
    }

    @GetMapping("/schedule-exceptions/{id}")
    public ScheduleException exception(@PathVariable Long id) {
        return scheduleAdminService.getException(id);
    }

    @PostMapping("/schedule-exceptions")
    @ResponseStatus(HttpStatus.CREATED)
    public ScheduleException createException(@Valid @RequestBody ScheduleExceptionRequest request) {
        return scheduleAdminService.createException(request);
    }

    @PutMapping("/schedule-exceptions/{id}")
    public ScheduleException updateException(@PathVariable Long id, @Valid @RequestBody ScheduleExceptionRequest request) {
        return scheduleAdminService.updateException(id, request);
    }

    @DeleteMapping("/schedule-exceptions/{id}")
    public Map<String, Object> deleteException(@PathVariable Long id) {
        scheduleAdminService.deleteException(id);
        return Map.of("success", true);
    }
}

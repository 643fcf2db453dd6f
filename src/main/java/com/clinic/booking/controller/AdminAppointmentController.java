package com.clinic.booking.controller;

import com.clinic.booking.dto.AppointmentUpdateRequest;
import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.dto.PhoneBookingRequest;
import com.clinic.booking.service.AppointmentAdminService;
import com.clinic.booking.service.AppointmentBookingService;
import com.clinic.booking.service.BookingOutcome;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/appointments")
public class AdminAppointmentController {

    private final AppointmentAdminService adminService;
    private final AppointmentBookingService bookingService;
    private final Clock clock;

    public AdminAppointmentController(AppointmentAdminService adminService,
                                      AppointmentBookingService bookingService,
                                      Clock clock) {
        this.adminService = adminService;
        this.bookingService = bookingService;
        this.clock = clock;
    }

    @GetMapping
    public List<AppointmentView> list(@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
                                      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
                                      @RequestParam(required = false) String status) {
        return adminService.list(start, end, status);
    }

    @GetMapping("/{id}")
    public AppointmentView get(@PathVariable Long id) {
        return adminService.get(id);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createPhoneBooking(@Valid @RequestBody PhoneBookingRequest request) {
        BookingOutcome outcome = bookingService.bookByPhone(request);
        if (!outcome.success()) {
            return ResponseEntity.badRequest().body(Map.of("error", outcome.message()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", outcome.message(),
                "appointment", AppointmentView.of(outcome.appointment(), clock.getZone())));
    }

    @PutMapping("/{id}")
    public Map<String, Object> update(@PathVariable Long id, @RequestBody AppointmentUpdateRequest request) {
        return Map.of("success", true, "appointment", adminService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable Long id) {
        adminService.delete(id);
        return Map.of("success", true);
    }
}

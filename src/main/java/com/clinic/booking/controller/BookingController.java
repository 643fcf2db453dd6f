package com.clinic.booking.controller;

import com.clinic.booking.availability.AvailableDate;
import com.clinic.booking.availability.AvailableDateService;
import com.clinic.booking.availability.SlotGenerator;
import com.clinic.booking.availability.SlotSearchResult;
import com.clinic.booking.dto.AppointmentRequest;
import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.dto.CancelRequest;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.service.AppointmentBookingService;
import com.clinic.booking.service.BookingOutcome;
import com.clinic.booking.service.BookingSettingsService;
import com.clinic.booking.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Public booking API used by the patient-facing calendar.
 */
@RestController
@RequestMapping("/api")
public class BookingController {

    private final CatalogService catalogService;
    private final AvailableDateService availableDateService;
    private final SlotGenerator slotGenerator;
    private final BookingSettingsService settingsService;
    private final AppointmentBookingService bookingService;
    private final Clock clock;

    public BookingController(CatalogService catalogService,
                             AvailableDateService availableDateService,
                             SlotGenerator slotGenerator,
                             BookingSettingsService settingsService,
                             AppointmentBookingService bookingService,
                             Clock clock) {
        this.catalogService = catalogService;
        this.availableDateService = availableDateService;
        this.slotGenerator = slotGenerator;
        this.settingsService = settingsService;
        this.bookingService = bookingService;
        this.clock = clock;
    }

    @GetMapping("/services")
    public List<ClinicService> services() {
        return catalogService.getActiveServices();
    }

    @GetMapping("/staff")
    public List<Staff> staff() {
        return catalogService.getActiveStaff();
    }

    @GetMapping("/available-dates")
    public List<AvailableDate> availableDates() {
        return availableDateService.listAvailableDates(settingsService.snapshot());
    }

    @GetMapping("/slots")
    public ResponseEntity<SlotSearchResult> slots(@RequestParam String date,
                                                  @RequestParam(required = false) Long serviceId,
                                                  @RequestParam(required = false) Long staffId) {
        SlotSearchResult result = slotGenerator.generate(date, serviceId, staffId, settingsService.snapshot());
        return result.isSuccess() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    @PostMapping("/appointments")
    public ResponseEntity<Map<String, Object>> book(@Valid @RequestBody AppointmentRequest request) {
        BookingOutcome outcome = bookingService.book(request);
        if (!outcome.success()) {
            return ResponseEntity.badRequest().body(Map.of("error", outcome.message()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(bookedBody(outcome));
    }

    @GetMapping("/appointments/by-token")
    public AppointmentView byToken(@RequestParam String token) {
        return bookingService.findByToken(token);
    }

    @PostMapping("/appointments/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@Valid @RequestBody CancelRequest request) {
        BookingOutcome outcome = bookingService.cancelByToken(request.getToken());
        if (!outcome.success()) {
            return ResponseEntity.badRequest().body(Map.of("error", outcome.message()));
        }
        return ResponseEntity.ok(Map.of("success", true, "message", outcome.message()));
    }

    Map<String, Object> bookedBody(BookingOutcome outcome) {
        AppointmentView view = AppointmentView.forPatient(outcome.appointment(), clock.getZone());
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", view.id());
        summary.put("startAt", view.startAt());
        summary.put("endAt", view.endAt());
        summary.put("service", view.serviceName());
        summary.put("staff", view.staffName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("appointmentId", view.id());
        body.put("accessToken", outcome.accessToken());
        body.put("message", outcome.message());
        body.put("appointment", summary);
        return body;
    }
}

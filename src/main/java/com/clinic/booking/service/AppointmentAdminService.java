package com.clinic.booking.service;

import com.clinic.booking.availability.BookingValidation;
import com.clinic.booking.availability.BookingValidator;
import com.clinic.booking.dto.AppointmentUpdateRequest;
import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.entity.Appointment;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.repository.AppointmentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

@Service
public class AppointmentAdminService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentAdminService.class);

    private final Clock clock;
    private final AppointmentRepository appointmentRepository;
    private final BookingValidator bookingValidator;
    private final BookingSettingsService settingsService;
    private final WeekdayLock weekdayLock;

    public AppointmentAdminService(Clock clock,
                                   AppointmentRepository appointmentRepository,
                                   BookingValidator bookingValidator,
                                   BookingSettingsService settingsService,
                                   WeekdayLock weekdayLock) {
        this.clock = clock;
        this.appointmentRepository = appointmentRepository;
        this.bookingValidator = bookingValidator;
        this.settingsService = settingsService;
        this.weekdayLock = weekdayLock;
    }

    /**
     * Appointments starting on clinic-local dates {@code from..to} inclusive.
     * Missing bounds default to today.
     */
    @Transactional(readOnly = true)
    public List<AppointmentView> list(LocalDate from, LocalDate to, String status) {
        ZoneId zone = clock.getZone();
        LocalDate start = from == null ? LocalDate.now(clock) : from;
        LocalDate end = to == null ? start : to;
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        Instant fromInstant = start.atStartOfDay(zone).toInstant();
        Instant toInstant = end.plusDays(1).atStartOfDay(zone).toInstant();

        List<Appointment> rows = StringUtils.isBlank(status)
                ? appointmentRepository.findByStartAtGreaterThanEqualAndStartAtLessThanOrderByStartAtAsc(fromInstant, toInstant)
                : appointmentRepository.findByStartAtGreaterThanEqualAndStartAtLessThanAndStatusOrderByStartAtAsc(
                        fromInstant, toInstant, Appointment.Status.fromValue(status));
        return rows.stream().map(a -> AppointmentView.of(a, zone)).toList();
    }

    @Transactional(readOnly = true)
    public AppointmentView get(Long id) {
        return AppointmentView.of(require(id), clock.getZone());
    }

    /**
     * Changes status and notes. Moving an appointment back to confirmed takes the
     * weekday lock and re-counts its window like a new booking would, and is
     * refused when the window is already full.
     */
    @Transactional
    public AppointmentView update(Long id, AppointmentUpdateRequest request) {
        Appointment appointment = require(id);
        if (StringUtils.isNotBlank(request.getStatus())) {
            Appointment.Status next = Appointment.Status.fromValue(request.getStatus());
            if (next == Appointment.Status.CONFIRMED && appointment.getStatus() != Appointment.Status.CONFIRMED) {
                weekdayLock.lock(appointment.getStartAt());
                BookingValidation capacity = bookingValidator.checkCapacity(appointment, settingsService.snapshot());
                if (!capacity.valid()) {
                    throw new IllegalArgumentException(capacity.error());
                }
            }
            log.info("Appointment {} status {} -> {}", id, appointment.getStatus().wireValue(), next.wireValue());
            appointment.setStatus(next);
        }
        if (request.getNotes() != null) {
            appointment.setNotes(request.getNotes());
        }
        return AppointmentView.of(appointmentRepository.save(appointment), clock.getZone());
    }

    @Transactional
    public void delete(Long id) {
        Appointment appointment = require(id);
        appointmentRepository.delete(appointment);
        log.info("Deleted appointment {}", id);
    }

    private Appointment require(Long id) {
        return appointmentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment not found: " + id));
    }
}

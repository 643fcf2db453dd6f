package com.clinic.booking.availability;

import com.clinic.booking.entity.Appointment;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.repository.AppointmentRepository;
import com.clinic.booking.repository.ClinicServiceRepository;
import com.clinic.booking.repository.StaffRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Re-checks a requested window against every booking rule right before it is
 * written. Run it inside the booking transaction, after the weekday lock is held,
 * so the overlap count sees all committed competitors.
 */
@Component
public class BookingValidator {

    private static final Logger log = LoggerFactory.getLogger(BookingValidator.class);

    static final String INVALID_INTERVAL = "Invalid interval";
    static final String PAST = "Cannot book a time in the past";
    static final String INVALID_SERVICE = "Invalid service";
    static final String INVALID_STAFF = "Invalid staff";
    static final String DURATION_MISMATCH = "Duration does not match the selected service";
    static final String OUTSIDE_HOURS = "Requested time is outside business hours";
    static final String ALREADY_BOOKED = "This time slot is already booked";

    private final Clock clock;
    private final ScheduleResolver scheduleResolver;
    private final CapacityResolver capacityResolver;
    private final ClinicServiceRepository serviceRepository;
    private final StaffRepository staffRepository;
    private final AppointmentRepository appointmentRepository;

    public BookingValidator(Clock clock,
                            ScheduleResolver scheduleResolver,
                            CapacityResolver capacityResolver,
                            ClinicServiceRepository serviceRepository,
                            StaffRepository staffRepository,
                            AppointmentRepository appointmentRepository) {
        this.clock = clock;
        this.scheduleResolver = scheduleResolver;
        this.capacityResolver = capacityResolver;
        this.serviceRepository = serviceRepository;
        this.staffRepository = staffRepository;
        this.appointmentRepository = appointmentRepository;
    }

    public BookingValidation validate(String startAtText, String endAtText, Long serviceId, Long staffId,
                                      SettingsSnapshot settings) {
        ZoneId zone = clock.getZone();
        Optional<Instant> start = ClinicTime.parseTimestamp(startAtText, zone);
        Optional<Instant> end = ClinicTime.parseTimestamp(endAtText, zone);
        if (start.isEmpty() || end.isEmpty()) {
            return BookingValidation.input(INVALID_INTERVAL);
        }
        return validate(start.get(), end.get(), serviceId, staffId, settings);
    }

    public BookingValidation validate(Instant startAt, Instant endAt, Long serviceId, Long staffId,
                                      SettingsSnapshot settings) {
        if (startAt == null || endAt == null || !startAt.isBefore(endAt)) {
            return BookingValidation.input(INVALID_INTERVAL);
        }
        ZoneId zone = clock.getZone();
        Instant now = clock.instant();
        if (!startAt.isAfter(now)) {
            return BookingValidation.policy(PAST);
        }

        LocalDateTime localStart = LocalDateTime.ofInstant(startAt, zone);
        LocalDateTime localEnd = LocalDateTime.ofInstant(endAt, zone);
        LocalDate date = localStart.toLocalDate();

        String windowError = settings.bookingWindowError(date, now, zone);
        if (windowError != null) {
            return BookingValidation.policy(windowError);
        }

        ResolvedSchedule schedule = scheduleResolver.resolve(date, settings);
        if (!schedule.open()) {
            return BookingValidation.policy(schedule.closureReason());
        }

        if (serviceId == null) {
            return BookingValidation.input(INVALID_SERVICE);
        }
        Optional<ClinicService> service = serviceRepository.findByIdAndActiveTrue(serviceId);
        if (service.isEmpty()) {
            return BookingValidation.policy(INVALID_SERVICE);
        }

        Staff staff = null;
        if (staffId != null) {
            staff = staffRepository.findByIdAndActiveTrue(staffId).orElse(null);
            if (staff == null) {
                return BookingValidation.policy(INVALID_STAFF);
            }
        }

        Duration length = Duration.between(startAt, endAt);
        if (!length.equals(Duration.ofMinutes(service.get().getDurationMinutes()))) {
            return BookingValidation.input(DURATION_MISMATCH);
        }
        boolean inPeriod = localEnd.toLocalDate().equals(date)
                && schedule.periods().stream().anyMatch(p -> p.contains(localStart.toLocalTime(), localEnd.toLocalTime()));
        if (!inPeriod || schedule.isBlocked(localStart.toLocalTime(), localEnd.toLocalTime())) {
            return BookingValidation.policy(OUTSIDE_HOURS);
        }

        long count = staffId == null
                ? appointmentRepository.countOverlapping(startAt, endAt, Appointment.Status.CONFIRMED)
                : appointmentRepository.countOverlappingForStaff(startAt, endAt, staffId, Appointment.Status.CONFIRMED);
        int capacity = capacityAt(schedule, localStart, settings);
        if (count >= capacity) {
            log.warn("Rejected booking {} - {}: {} of {} places taken", startAt, endAt, count, capacity);
            return BookingValidation.conflict(ALREADY_BOOKED);
        }
        return BookingValidation.ok(startAt, endAt, service.get(), staff);
    }

    /**
     * Capacity check alone for an existing appointment that is being confirmed
     * again, counting every other confirmed appointment it overlaps. Hours and
     * cutoff are not re-applied.
     */
    public BookingValidation checkCapacity(Appointment appointment, SettingsSnapshot settings) {
        Instant startAt = appointment.getStartAt();
        Instant endAt = appointment.getEndAt();
        Long staffId = appointment.getStaff() == null ? null : appointment.getStaff().getId();
        long count = staffId == null
                ? appointmentRepository.countOverlappingExcluding(startAt, endAt,
                        Appointment.Status.CONFIRMED, appointment.getId())
                : appointmentRepository.countOverlappingForStaffExcluding(startAt, endAt, staffId,
                        Appointment.Status.CONFIRMED, appointment.getId());
        LocalDateTime localStart = LocalDateTime.ofInstant(startAt, clock.getZone());
        int capacity = capacityAt(scheduleResolver.resolve(localStart.toLocalDate(), settings), localStart, settings);
        if (count >= capacity) {
            log.warn("Refused to confirm appointment {} again: {} of {} places taken",
                    appointment.getId(), count, capacity);
            return BookingValidation.conflict(ALREADY_BOOKED);
        }
        return BookingValidation.ok(startAt, endAt, appointment.getService(), appointment.getStaff());
    }

    private int capacityAt(ResolvedSchedule schedule, LocalDateTime localStart, SettingsSnapshot settings) {
        LocalDate date = localStart.toLocalDate();
        LocalTime slotTime = schedule.gridTimeAt(localStart.toLocalTime(), settings.slotDurationMinutes());
        return capacityResolver.resolve(ScheduleResolver.dayOfWeek(date), slotTime, date, settings);
    }
}

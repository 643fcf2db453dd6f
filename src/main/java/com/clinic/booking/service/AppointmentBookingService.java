package com.clinic.booking.service;

import com.clinic.booking.availability.BookingValidation;
import com.clinic.booking.availability.BookingValidator;
import com.clinic.booking.availability.ClinicTime;
import com.clinic.booking.availability.ErrorKind;
import com.clinic.booking.availability.SettingsSnapshot;
import com.clinic.booking.dto.AppointmentRequest;
import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.dto.PhoneBookingRequest;
import com.clinic.booking.entity.Appointment;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Patient;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.repository.AppointmentRepository;
import com.clinic.booking.repository.ClinicServiceRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Patient-facing booking: validate-then-insert under a per-weekday lock, and
 * lookup or cancellation through the access token handed out at booking time.
 */
@Service
public class AppointmentBookingService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentBookingService.class);

    static final Duration TOKEN_VALIDITY = Duration.ofDays(30);
    static final String BOOKED_MESSAGE = "Your appointment has been booked";
    static final String CANCELLED_MESSAGE = "Your appointment has been cancelled";
    static final String TOKEN_NOT_FOUND = "Appointment not found or the link has expired";
    static final String INVALID_PHONE = "Invalid phone number";

    private final Clock clock;
    private final BookingValidator bookingValidator;
    private final BookingSettingsService settingsService;
    private final PatientService patientService;
    private final AppointmentRepository appointmentRepository;
    private final WeekdayLock weekdayLock;
    private final ClinicServiceRepository serviceRepository;

    public AppointmentBookingService(Clock clock,
                                     BookingValidator bookingValidator,
                                     BookingSettingsService settingsService,
                                     PatientService patientService,
                                     AppointmentRepository appointmentRepository,
                                     WeekdayLock weekdayLock,
                                     ClinicServiceRepository serviceRepository) {
        this.clock = clock;
        this.bookingValidator = bookingValidator;
        this.settingsService = settingsService;
        this.patientService = patientService;
        this.appointmentRepository = appointmentRepository;
        this.weekdayLock = weekdayLock;
        this.serviceRepository = serviceRepository;
    }

    /**
     * Books the requested window. Holds the weekday's business-hours row lock for
     * the whole transaction, so two requests for the same weekday are validated
     * and written one after the other.
     */
    @Transactional
    public BookingOutcome book(AppointmentRequest request) {
        if (!PatientService.isValidPhone(PatientService.normalizePhone(request.getPhone()))) {
            return BookingOutcome.rejected(ErrorKind.INPUT, INVALID_PHONE);
        }
        SettingsSnapshot settings = settingsService.snapshot();
        ZoneId zone = clock.getZone();
        Optional<Instant> start = ClinicTime.parseTimestamp(request.getStartAt(), zone);
        if (start.isPresent()) {
            weekdayLock.lock(start.get());
        }

        BookingValidation validation = bookingValidator.validate(
                request.getStartAt(), request.getEndAt(), request.getServiceId(), request.getStaffId(), settings);
        if (!validation.valid()) {
            log.warn("Booking rejected ({}): {} for startAt={} service={} staff={}",
                    validation.errorKind(), validation.error(), request.getStartAt(),
                    request.getServiceId(), request.getStaffId());
            return BookingOutcome.rejected(validation.errorKind(), validation.error());
        }

        Patient patient = patientService.findOrCreate(request.getName(), request.getKana(),
                request.getPhone(), request.getEmail(), request.getAddress());
        String token = AccessTokens.generate();
        Appointment appointment = appointmentRepository.save(Appointment.builder()
                .patient(patient)
                .service(validation.service())
                .staff(validation.staff())
                .startAt(validation.startAt())
                .endAt(validation.endAt())
                .status(Appointment.Status.CONFIRMED)
                .accessTokenHash(AccessTokens.hash(token))
                .tokenExpiresAt(clock.instant().plus(TOKEN_VALIDITY))
                .build());

        log.info("Booked appointment {}: {} - {}, service={}, staff={}, patient={}",
                appointment.getId(), appointment.getStartAt(), appointment.getEndAt(),
                validation.service().getName(),
                validation.staff() == null ? "-" : validation.staff().getName(),
                patient.getId());
        return BookingOutcome.booked(appointment, token, BOOKED_MESSAGE);
    }

    /**
     * Booking entered by reception staff. The end time follows from the service
     * duration and the window still passes every booking rule.
     */
    @Transactional
    public BookingOutcome bookByPhone(PhoneBookingRequest request) {
        SettingsSnapshot settings = settingsService.snapshot();
        ZoneId zone = clock.getZone();
        Optional<Instant> start = ClinicTime.parseTimestamp(request.getStartAt(), zone);
        if (start.isEmpty()) {
            return BookingOutcome.rejected(ErrorKind.INPUT, "Invalid interval");
        }
        if (StringUtils.isNotBlank(request.getPhone())
                && !PatientService.isValidPhone(PatientService.normalizePhone(request.getPhone()))) {
            return BookingOutcome.rejected(ErrorKind.INPUT, INVALID_PHONE);
        }
        ClinicService service = serviceRepository.findByIdAndActiveTrue(request.getServiceId()).orElse(null);
        if (service == null) {
            return BookingOutcome.rejected(ErrorKind.POLICY, "Invalid service");
        }
        weekdayLock.lock(start.get());

        Instant end = start.get().plus(Duration.ofMinutes(service.getDurationMinutes()));
        BookingValidation validation = bookingValidator.validate(
                start.get(), end, service.getId(), request.getStaffId(), settings);
        if (!validation.valid()) {
            log.warn("Phone booking rejected ({}): {} for startAt={}",
                    validation.errorKind(), validation.error(), request.getStartAt());
            return BookingOutcome.rejected(validation.errorKind(), validation.error());
        }

        Patient patient = patientService.forPhoneBooking(request.getName(), request.getKana(), request.getPhone());
        String token = AccessTokens.generate();
        Appointment appointment = appointmentRepository.save(Appointment.builder()
                .patient(patient)
                .service(validation.service())
                .staff(validation.staff())
                .startAt(validation.startAt())
                .endAt(validation.endAt())
                .status(Appointment.Status.CONFIRMED)
                .accessTokenHash(AccessTokens.hash(token))
                .tokenExpiresAt(clock.instant().plus(TOKEN_VALIDITY))
                .notes(StringUtils.trimToNull(request.getNotes()))
                .build());
        log.info("Phone booking {} created: {} - {}", appointment.getId(), appointment.getStartAt(), appointment.getEndAt());
        return BookingOutcome.booked(appointment, token, BOOKED_MESSAGE);
    }

    @Transactional(readOnly = true)
    public AppointmentView findByToken(String token) {
        return AppointmentView.forPatient(requireByToken(token), clock.getZone());
    }

    /**
     * Cancels a confirmed appointment unless it starts within the cutoff window.
     */
    @Transactional
    public BookingOutcome cancelByToken(String token) {
        Appointment appointment = requireByToken(token);
        if (appointment.getStatus() != Appointment.Status.CONFIRMED) {
            throw new ResourceNotFoundException("Appointment not found or already cancelled");
        }
        SettingsSnapshot settings = settingsService.snapshot();
        Instant deadline = appointment.getStartAt().minus(Duration.ofDays(settings.cutoffDays()));
        if (clock.instant().isAfter(deadline)) {
            return BookingOutcome.rejected(ErrorKind.POLICY,
                    "Cancellation is only possible up to " + settings.cutoffDays()
                            + " days before the appointment. Please call the clinic.");
        }
        appointment.setStatus(Appointment.Status.CANCELLED);
        appointmentRepository.save(appointment);
        log.info("Cancelled appointment {} by patient token", appointment.getId());
        return BookingOutcome.done(appointment, CANCELLED_MESSAGE);
    }

    private Appointment requireByToken(String token) {
        if (StringUtils.isBlank(token)) {
            throw new IllegalArgumentException("token is required");
        }
        return appointmentRepository
                .findByAccessTokenHashAndTokenExpiresAtAfter(AccessTokens.hash(token.trim()), clock.instant())
                .orElseThrow(() -> new ResourceNotFoundException(TOKEN_NOT_FOUND));
    }
}

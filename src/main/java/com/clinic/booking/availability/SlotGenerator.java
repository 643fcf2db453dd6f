package com.clinic.booking.availability;

import com.clinic.booking.entity.Appointment;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.repository.AppointmentRepository;
import com.clinic.booking.repository.ClinicServiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Candidate booking windows for one date and service. Windows are walked from
 * each period's open time in steps of the configured slot duration; each carries
 * its booked count and capacity so callers can show full slots as unavailable.
 */
@Component
public class SlotGenerator {

    private static final Logger log = LoggerFactory.getLogger(SlotGenerator.class);

    static final String INVALID_DATE = "Invalid date";
    static final String INVALID_SERVICE = "Invalid service";

    private final Clock clock;
    private final ScheduleResolver scheduleResolver;
    private final CapacityResolver capacityResolver;
    private final ClinicServiceRepository serviceRepository;
    private final AppointmentRepository appointmentRepository;

    public SlotGenerator(Clock clock,
                         ScheduleResolver scheduleResolver,
                         CapacityResolver capacityResolver,
                         ClinicServiceRepository serviceRepository,
                         AppointmentRepository appointmentRepository) {
        this.clock = clock;
        this.scheduleResolver = scheduleResolver;
        this.capacityResolver = capacityResolver;
        this.serviceRepository = serviceRepository;
        this.appointmentRepository = appointmentRepository;
    }

    @Transactional(readOnly = true)
    public SlotSearchResult generate(String dateText, Long serviceId, Long staffId, SettingsSnapshot settings) {
        Optional<LocalDate> parsed = ClinicTime.parseDate(dateText);
        if (parsed.isEmpty()) {
            return SlotSearchResult.failure(ErrorKind.INPUT, INVALID_DATE);
        }
        LocalDate date = parsed.get();
        ZoneId zone = clock.getZone();
        Instant now = clock.instant();

        String windowError = settings.bookingWindowError(date, now, zone);
        if (windowError != null) {
            return SlotSearchResult.failure(ErrorKind.POLICY, windowError);
        }

        ResolvedSchedule schedule = scheduleResolver.resolve(date, settings);
        if (!schedule.open()) {
            return SlotSearchResult.failure(ErrorKind.POLICY, schedule.closureReason());
        }

        if (serviceId == null) {
            return SlotSearchResult.failure(ErrorKind.INPUT, INVALID_SERVICE);
        }
        ClinicService service = serviceRepository.findByIdAndActiveTrue(serviceId).orElse(null);
        if (service == null) {
            return SlotSearchResult.failure(ErrorKind.POLICY, INVALID_SERVICE);
        }

        List<Slot> slots = walk(schedule, service.getDurationMinutes(), staffId, settings, now, zone);
        log.debug("Generated {} slots for date={} service={} staff={}", slots.size(), date, serviceId, staffId);
        return SlotSearchResult.of(slots);
    }

    private List<Slot> walk(ResolvedSchedule schedule, int durationMinutes, Long staffId,
                            SettingsSnapshot settings, Instant now, ZoneId zone) {
        LocalDate date = schedule.date();
        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();
        List<Appointment> booked = appointmentRepository.findOverlapping(dayStart, dayEnd, Appointment.Status.CONFIRMED);
        DayCapacity capacity = capacityResolver.resolveDay(date, settings);
        int step = Math.max(1, settings.slotDurationMinutes());

        List<Slot> slots = new ArrayList<>();
        for (TimePeriod period : schedule.periods()) {
            LocalDateTime closeAt = date.atTime(period.close());
            for (LocalDateTime cur = date.atTime(period.open());
                 !cur.plusMinutes(durationMinutes).isAfter(closeAt);
                 cur = cur.plusMinutes(step)) {
                LocalDateTime end = cur.plusMinutes(durationMinutes);
                if (schedule.isBlocked(cur.toLocalTime(), end.toLocalTime())) {
                    continue;
                }
                Instant startInstant = cur.atZone(zone).toInstant();
                if (!startInstant.isAfter(now)) {
                    continue;
                }
                Instant endInstant = end.atZone(zone).toInstant();
                int count = countOverlapping(booked, startInstant, endInstant, staffId);
                int cap = capacity.capacityAt(cur.toLocalTime());
                slots.add(new Slot(
                        ClinicTime.hourMinute(cur.toLocalTime()),
                        ClinicTime.hourMinute(end.toLocalTime()),
                        ClinicTime.format(cur, zone),
                        ClinicTime.format(end, zone),
                        count < cap,
                        count,
                        cap));
            }
        }
        return slots;
    }

    /**
     * Confirmed appointments intersecting [start, end). With a staff filter only that
     * staff member's bookings and unassigned bookings count.
     */
    static int countOverlapping(List<Appointment> booked, Instant start, Instant end, Long staffId) {
        int count = 0;
        for (Appointment a : booked) {
            if (!a.getStartAt().isBefore(end) || !a.getEndAt().isAfter(start)) {
                continue;
            }
            if (staffId != null && a.getStaff() != null && !staffId.equals(a.getStaff().getId())) {
                continue;
            }
            count++;
        }
        return count;
    }
}

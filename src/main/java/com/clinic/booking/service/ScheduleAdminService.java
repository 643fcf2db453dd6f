package com.clinic.booking.service;

import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.dto.BusinessHoursRequest;
import com.clinic.booking.dto.HolidayRequest;
import com.clinic.booking.dto.ScheduleExceptionRequest;
import com.clinic.booking.entity.Appointment;
import com.clinic.booking.entity.BusinessHours;
import com.clinic.booking.entity.Holiday;
import com.clinic.booking.entity.ScheduleException;
import com.clinic.booking.entity.ScheduleExceptionType;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.repository.AppointmentRepository;
import com.clinic.booking.repository.BusinessHoursRepository;
import com.clinic.booking.repository.HolidayRepository;
import com.clinic.booking.repository.ScheduleExceptionRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Stream;

/**
 * Admin maintenance of weekly hours, holidays and date-scoped schedule exceptions.
 */
@Service
public class ScheduleAdminService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleAdminService.class);

    private final Clock clock;
    private final BusinessHoursRepository businessHoursRepository;
    private final HolidayRepository holidayRepository;
    private final ScheduleExceptionRepository exceptionRepository;
    private final AppointmentRepository appointmentRepository;

    public ScheduleAdminService(Clock clock,
                                BusinessHoursRepository businessHoursRepository,
                                HolidayRepository holidayRepository,
                                ScheduleExceptionRepository exceptionRepository,
                                AppointmentRepository appointmentRepository) {
        this.clock = clock;
        this.businessHoursRepository = businessHoursRepository;
        this.holidayRepository = holidayRepository;
        this.exceptionRepository = exceptionRepository;
        this.appointmentRepository = appointmentRepository;
    }

    // business hours

    @Transactional(readOnly = true)
    public List<BusinessHours> listBusinessHours() {
        return businessHoursRepository.findAllByOrderByDayOfWeekAsc();
    }

    @Transactional
    public BusinessHours updateBusinessHours(int dayOfWeek, BusinessHoursRequest request) {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("Invalid day of week: " + dayOfWeek);
        }
        BusinessHours hours = businessHoursRepository.findByDayOfWeek(dayOfWeek)
                .orElseThrow(() -> new ResourceNotFoundException("Business hours not found for day " + dayOfWeek));
        if (request.isClosed()) {
            hours.setClosed(true);
            hours.setMorningOpen(null);
            hours.setMorningClose(null);
            hours.setAfternoonOpen(null);
            hours.setAfternoonClose(null);
        } else {
            requirePair("morning", request.getMorningOpen(), request.getMorningClose());
            requirePair("afternoon", request.getAfternoonOpen(), request.getAfternoonClose());
            hours.setClosed(false);
            hours.setMorningOpen(request.getMorningOpen());
            hours.setMorningClose(request.getMorningClose());
            hours.setAfternoonOpen(request.getAfternoonOpen());
            hours.setAfternoonClose(request.getAfternoonClose());
        }
        BusinessHours saved = businessHoursRepository.save(hours);
        log.info("Business hours updated for day {}: closed={}, morning={}-{}, afternoon={}-{}",
                dayOfWeek, saved.isClosed(), saved.getMorningOpen(), saved.getMorningClose(),
                saved.getAfternoonOpen(), saved.getAfternoonClose());
        return saved;
    }

    // holidays

    @Transactional(readOnly = true)
    public List<Holiday> listHolidays() {
        return holidayRepository.findAllByOrderByDateAsc();
    }

    @Transactional
    public Holiday createHoliday(HolidayRequest request) {
        if (holidayRepository.existsByDate(request.getDate())) {
            throw new IllegalArgumentException("A holiday already exists on " + request.getDate());
        }
        Holiday saved = holidayRepository.save(Holiday.builder()
                .date(request.getDate())
                .name(StringUtils.trimToNull(request.getName()))
                .build());
        log.info("Holiday added: {} {}", saved.getDate(), saved.getName());
        return saved;
    }

    @Transactional
    public void deleteHoliday(Long id) {
        Holiday holiday = holidayRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Holiday not found: " + id));
        holidayRepository.delete(holiday);
        log.info("Holiday removed: {}", holiday.getDate());
    }

    // schedule exceptions

    @Transactional(readOnly = true)
    public List<ScheduleException> listExceptions(LocalDate from, LocalDate to, ScheduleExceptionType type) {
        Stream<ScheduleException> rows;
        if (from != null && to != null) {
            rows = exceptionRepository.findOverlappingRange(from, to).stream();
        } else if (type != null) {
            rows = exceptionRepository.findByTypeOrderByStartDateAscStartTimeAsc(type).stream();
        } else {
            rows = exceptionRepository.findAllByOrderByStartDateAscStartTimeAsc().stream();
        }
        return rows
                .filter(e -> from == null || !e.getEndDate().isBefore(from))
                .filter(e -> to == null || !e.getStartDate().isAfter(to))
                .filter(e -> type == null || e.getType() == type)
                .toList();
    }

    @Transactional(readOnly = true)
    public ScheduleException getException(Long id) {
        return exceptionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule exception not found: " + id));
    }

    @Transactional
    public ScheduleException createException(ScheduleExceptionRequest request) {
        ScheduleException exception = new ScheduleException();
        apply(exception, request);
        ScheduleException saved = exceptionRepository.save(exception);
        log.info("Schedule exception {} created: {} {}..{}", saved.getId(), saved.getType().getValue(),
                saved.getStartDate(), saved.getEndDate());
        return saved;
    }

    @Transactional
    public ScheduleException updateException(Long id, ScheduleExceptionRequest request) {
        ScheduleException exception = getException(id);
        apply(exception, request);
        ScheduleException saved = exceptionRepository.save(exception);
        log.info("Schedule exception {} updated: {} {}..{}", id, saved.getType().getValue(),
                saved.getStartDate(), saved.getEndDate());
        return saved;
    }

    @Transactional
    public void deleteException(Long id) {
        ScheduleException exception = getException(id);
        exceptionRepository.delete(exception);
        log.info("Schedule exception {} deleted", id);
    }

    /**
     * Confirmed appointments starting on {@code startDate..endDate} (clinic-local),
     * narrowed to those intersecting {@code startTime..endTime} when both are given.
     */
    @Transactional(readOnly = true)
    public List<AppointmentView> affectedAppointments(LocalDate startDate, LocalDate endDate,
                                                      LocalTime startTime, LocalTime endTime) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        ZoneId zone = clock.getZone();
        Instant from = startDate.atStartOfDay(zone).toInstant();
        Instant to = endDate.plusDays(1).atStartOfDay(zone).toInstant();
        boolean timeFilter = startTime != null && endTime != null;

        return appointmentRepository
                .findByStartAtGreaterThanEqualAndStartAtLessThanAndStatusOrderByStartAtAsc(from, to, Appointment.Status.CONFIRMED)
                .stream()
                .filter(a -> !timeFilter || intersects(a, startTime, endTime, zone))
                .map(a -> AppointmentView.of(a, zone))
                .toList();
    }

    private static boolean intersects(Appointment a, LocalTime startTime, LocalTime endTime, ZoneId zone) {
        LocalTime start = a.getStartAt().atZone(zone).toLocalTime();
        LocalTime end = a.getEndAt().atZone(zone).toLocalTime();
        return start.isBefore(endTime) && end.isAfter(startTime);
    }

    private static void apply(ScheduleException target, ScheduleExceptionRequest request) {
        if (request.getType() == null) {
            throw new IllegalArgumentException("Exception type is required");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        if (request.getType() == ScheduleExceptionType.PARTIAL_CLOSED) {
            if (request.getStartTime() == null || request.getEndTime() == null
                    || !request.getEndTime().isAfter(request.getStartTime())) {
                throw new IllegalArgumentException("Partial closure requires startTime before endTime");
            }
        }
        requirePair("morning", request.getMorningOpen(), request.getMorningClose());
        requirePair("afternoon", request.getAfternoonOpen(), request.getAfternoonClose());

        target.setType(request.getType());
        target.setStartDate(request.getStartDate());
        target.setEndDate(request.getEndDate());
        target.setStartTime(request.getStartTime());
        target.setEndTime(request.getEndTime());
        target.setMorningOpen(request.getMorningOpen());
        target.setMorningClose(request.getMorningClose());
        target.setAfternoonOpen(request.getAfternoonOpen());
        target.setAfternoonClose(request.getAfternoonClose());
        target.setReason(StringUtils.trimToNull(request.getReason()));
        target.setNotes(StringUtils.trimToNull(request.getNotes()));
        target.setRecurring(request.isRecurring());
    }

    private static void requirePair(String label, LocalTime open, LocalTime close) {
        if (open == null && close == null) {
            return;
        }
        if (open == null || close == null || !close.isAfter(open)) {
            throw new IllegalArgumentException(label + " close must be after " + label + " open");
        }
    }
}

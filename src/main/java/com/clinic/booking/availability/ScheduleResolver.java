package com.clinic.booking.availability;

import com.clinic.booking.entity.BusinessHours;
import com.clinic.booking.entity.Holiday;
import com.clinic.booking.entity.ScheduleException;
import com.clinic.booking.entity.ScheduleExceptionType;
import com.clinic.booking.repository.BusinessHoursRepository;
import com.clinic.booking.repository.HolidayRepository;
import com.clinic.booking.repository.ScheduleExceptionRepository;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Merges holidays, schedule exceptions and weekly business hours into the
 * effective opening of one date. Reads only; never writes.
 */
@Component
public class ScheduleResolver {

    static final String HOLIDAY_REASON = "Holiday";
    static final String TEMPORARY_CLOSURE_REASON = "Temporary closure";
    static final String CLOSED_REASON = "Closed";

    private final BusinessHoursRepository businessHoursRepository;
    private final HolidayRepository holidayRepository;
    private final ScheduleExceptionRepository exceptionRepository;

    public ScheduleResolver(BusinessHoursRepository businessHoursRepository,
                            HolidayRepository holidayRepository,
                            ScheduleExceptionRepository exceptionRepository) {
        this.businessHoursRepository = businessHoursRepository;
        this.holidayRepository = holidayRepository;
        this.exceptionRepository = exceptionRepository;
    }

    public ResolvedSchedule resolve(LocalDate date, SettingsSnapshot settings) {
        Optional<Holiday> holiday = holidayRepository.findByDate(date);
        if (holiday.isPresent()) {
            return ResolvedSchedule.closed(date, StringUtils.defaultIfBlank(holiday.get().getName(), HOLIDAY_REASON), null);
        }
        List<ScheduleException> exceptions = exceptionRepository.findCovering(date);
        BusinessHours hours = businessHoursRepository.findByDayOfWeek(dayOfWeek(date)).orElse(null);
        return merge(date, null, exceptions, hours, settings);
    }

    /**
     * Pure merge over pre-loaded rows, used directly when a caller has bulk-loaded
     * a whole date range.
     *
     * @param holiday the holiday on {@code date}, or null
     * @param exceptions candidate exceptions; those not covering {@code date} are ignored
     * @param hours the weekday row for {@code date}, or null when missing
     */
    public ResolvedSchedule merge(LocalDate date,
                                  Holiday holiday,
                                  Collection<ScheduleException> exceptions,
                                  BusinessHours hours,
                                  SettingsSnapshot settings) {
        if (holiday != null) {
            return ResolvedSchedule.closed(date, StringUtils.defaultIfBlank(holiday.getName(), HOLIDAY_REASON), null);
        }

        ScheduleException winner = winningException(date, exceptions).orElse(null);
        ScheduleExceptionType type = winner == null ? null : winner.getType();

        if (type == ScheduleExceptionType.CLOSED) {
            return ResolvedSchedule.closed(date, StringUtils.defaultIfBlank(winner.getReason(), TEMPORARY_CLOSURE_REASON), type);
        }

        if (type == ScheduleExceptionType.MODIFIED_HOURS) {
            List<TimePeriod> periods = pairs(winner.getMorningOpen(), winner.getMorningClose(),
                    winner.getAfternoonOpen(), winner.getAfternoonClose());
            return openOrClosed(date, periods, null, type);
        }

        if (type == ScheduleExceptionType.SPECIAL_OPEN) {
            TimePeriod morning = TimePeriod.ofNullable(winner.getMorningOpen(), winner.getMorningClose());
            TimePeriod afternoon = TimePeriod.ofNullable(winner.getAfternoonOpen(), winner.getAfternoonClose());
            if (hours != null) {
                if (morning == null) morning = TimePeriod.ofNullable(hours.getMorningOpen(), hours.getMorningClose());
                if (afternoon == null) afternoon = TimePeriod.ofNullable(hours.getAfternoonOpen(), hours.getAfternoonClose());
            }
            List<TimePeriod> periods = new ArrayList<>();
            if (morning != null) periods.add(morning);
            if (afternoon != null) periods.add(afternoon);
            if (periods.isEmpty() && hours != null) {
                periods.addAll(legacyPeriods(hours, settings));
            }
            return openOrClosed(date, periods, null, type);
        }

        if (hours == null || hours.isClosed()) {
            return ResolvedSchedule.closed(date, CLOSED_REASON, type);
        }
        List<TimePeriod> periods = weeklyPeriods(hours, settings);
        TimePeriod blocked = type == ScheduleExceptionType.PARTIAL_CLOSED
                ? TimePeriod.ofNullable(winner.getStartTime(), winner.getEndTime())
                : null;
        return openOrClosed(date, periods, blocked, type);
    }

    /**
     * Weekday index used throughout the schedule tables: 0 = Sunday, 6 = Saturday.
     */
    public static int dayOfWeek(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    static Optional<ScheduleException> winningException(LocalDate date, Collection<ScheduleException> exceptions) {
        if (exceptions == null) {
            return Optional.empty();
        }
        return exceptions.stream()
                .filter(e -> e.getType() != null && e.covers(date))
                .min(Comparator.comparingInt((ScheduleException e) -> e.getType().precedence())
                        .thenComparing(ScheduleException::getStartDate)
                        .thenComparing(e -> e.getId() == null ? Long.MAX_VALUE : e.getId()));
    }

    private List<TimePeriod> weeklyPeriods(BusinessHours hours, SettingsSnapshot settings) {
        List<TimePeriod> periods = pairs(hours.getMorningOpen(), hours.getMorningClose(),
                hours.getAfternoonOpen(), hours.getAfternoonClose());
        if (!periods.isEmpty()) {
            return periods;
        }
        return legacyPeriods(hours, settings);
    }

    /**
     * The single open/close pair with the lunch break cut out of it.
     */
    static List<TimePeriod> legacyPeriods(BusinessHours hours, SettingsSnapshot settings) {
        TimePeriod legacy = TimePeriod.ofNullable(hours.getOpenTime(), hours.getCloseTime());
        if (legacy == null) {
            return List.of();
        }
        LocalTime lunchStart = settings.lunchStart();
        LocalTime lunchEnd = settings.lunchEnd();
        if (lunchStart == null || lunchEnd == null || !lunchEnd.isAfter(lunchStart)
                || !legacy.overlaps(lunchStart, lunchEnd)) {
            return List.of(legacy);
        }
        List<TimePeriod> split = new ArrayList<>(2);
        TimePeriod before = TimePeriod.ofNullable(legacy.open(), lunchStart);
        TimePeriod after = TimePeriod.ofNullable(lunchEnd, legacy.close());
        if (before != null) split.add(before);
        if (after != null) split.add(after);
        return split;
    }

    private static List<TimePeriod> pairs(LocalTime morningOpen, LocalTime morningClose,
                                          LocalTime afternoonOpen, LocalTime afternoonClose) {
        List<TimePeriod> periods = new ArrayList<>(2);
        TimePeriod morning = TimePeriod.ofNullable(morningOpen, morningClose);
        TimePeriod afternoon = TimePeriod.ofNullable(afternoonOpen, afternoonClose);
        if (morning != null) periods.add(morning);
        if (afternoon != null) periods.add(afternoon);
        return periods;
    }

    private static ResolvedSchedule openOrClosed(LocalDate date, List<TimePeriod> periods,
                                                 TimePeriod blocked, ScheduleExceptionType type) {
        if (periods.isEmpty()) {
            return ResolvedSchedule.closed(date, CLOSED_REASON, type);
        }
        List<TimePeriod> sorted = new ArrayList<>(periods);
        sorted.sort(Comparator.comparing(TimePeriod::open));
        return new ResolvedSchedule(date, true, sorted, null, blocked, type);
    }
}

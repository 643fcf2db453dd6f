package com.clinic.booking.availability;

import com.clinic.booking.entity.BusinessHours;
import com.clinic.booking.entity.Holiday;
import com.clinic.booking.entity.ScheduleException;
import com.clinic.booking.repository.BusinessHoursRepository;
import com.clinic.booking.repository.HolidayRepository;
import com.clinic.booking.repository.ScheduleExceptionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enumerates the bookable dates between today and the booking horizon.
 * Holidays, exceptions and weekly hours for the whole range are read with one
 * query each and merged in memory.
 */
@Service
public class AvailableDateService {

    private final Clock clock;
    private final ScheduleResolver scheduleResolver;
    private final BusinessHoursRepository businessHoursRepository;
    private final HolidayRepository holidayRepository;
    private final ScheduleExceptionRepository exceptionRepository;

    public AvailableDateService(Clock clock,
                                ScheduleResolver scheduleResolver,
                                BusinessHoursRepository businessHoursRepository,
                                HolidayRepository holidayRepository,
                                ScheduleExceptionRepository exceptionRepository) {
        this.clock = clock;
        this.scheduleResolver = scheduleResolver;
        this.businessHoursRepository = businessHoursRepository;
        this.holidayRepository = holidayRepository;
        this.exceptionRepository = exceptionRepository;
    }

    @Transactional(readOnly = true)
    public List<AvailableDate> listAvailableDates(SettingsSnapshot settings) {
        ZoneId zone = clock.getZone();
        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        LocalDate last = settings.lastBookableDate(today);

        Map<LocalDate, Holiday> holidays = holidayRepository.findByDateBetween(today, last).stream()
                .collect(Collectors.toMap(Holiday::getDate, Function.identity(), (a, b) -> a));
        List<ScheduleException> exceptions = exceptionRepository.findOverlappingRange(today, last);
        Map<Integer, BusinessHours> weekly = new HashMap<>();
        for (BusinessHours hours : businessHoursRepository.findAllByOrderByDayOfWeekAsc()) {
            weekly.put(hours.getDayOfWeek(), hours);
        }

        List<AvailableDate> dates = new ArrayList<>();
        for (LocalDate date = today; !date.isAfter(last); date = date.plusDays(1)) {
            if (now.isAfter(settings.cutoffInstant(date, zone))) {
                continue;
            }
            int dow = ScheduleResolver.dayOfWeek(date);
            ResolvedSchedule schedule = scheduleResolver.merge(date, holidays.get(date), exceptions, weekly.get(dow), settings);
            if (!schedule.open()) {
                continue;
            }
            LocalDate d = date;
            boolean hasException = exceptions.stream().anyMatch(e -> e.covers(d));
            dates.add(new AvailableDate(date, dow, dayName(date), hasException));
        }
        return dates;
    }

    static String dayName(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }
}

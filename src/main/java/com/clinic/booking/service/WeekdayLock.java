package com.clinic.booking.service;

import com.clinic.booking.availability.ScheduleResolver;
import com.clinic.booking.repository.BusinessHoursRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Serializes writes that change how many confirmed appointments sit on one
 * weekday. Must be called inside the caller's transaction; the lock is held
 * until it commits.
 */
@Component
public class WeekdayLock {

    private final Clock clock;
    private final BusinessHoursRepository businessHoursRepository;

    public WeekdayLock(Clock clock, BusinessHoursRepository businessHoursRepository) {
        this.clock = clock;
        this.businessHoursRepository = businessHoursRepository;
    }

    /**
     * Takes the row lock on the weekday of {@code startAt}. Every weekday row is
     * created at startup, so a missing row is a broken installation.
     */
    public void lock(Instant startAt) {
        int dayOfWeek = ScheduleResolver.dayOfWeek(startAt.atZone(clock.getZone()).toLocalDate());
        businessHoursRepository.findByDayOfWeekForUpdate(dayOfWeek)
                .orElseThrow(() -> new IllegalStateException("No business_hours row for weekday " + dayOfWeek));
    }
}

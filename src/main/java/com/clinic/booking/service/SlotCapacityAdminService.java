package com.clinic.booking.service;

import com.clinic.booking.availability.CapacityResolver;
import com.clinic.booking.availability.ClinicTime;
import com.clinic.booking.availability.DayCapacity;
import com.clinic.booking.availability.ResolvedSchedule;
import com.clinic.booking.availability.ScheduleResolver;
import com.clinic.booking.availability.SettingsSnapshot;
import com.clinic.booking.availability.TimePeriod;
import com.clinic.booking.dto.CapacityCell;
import com.clinic.booking.dto.CapacityMatrixView;
import com.clinic.booking.dto.DateCapacityView;
import com.clinic.booking.entity.SlotCapacity;
import com.clinic.booking.repository.SlotCapacityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Admin maintenance of per-slot capacity overrides, weekly and per date.
 */
@Service
public class SlotCapacityAdminService {

    private static final Logger log = LoggerFactory.getLogger(SlotCapacityAdminService.class);

    /** Grid shown for dates the clinic is closed on. */
    static final TimePeriod FALLBACK_GRID = new TimePeriod(LocalTime.of(9, 0), LocalTime.of(19, 0));

    private final SlotCapacityRepository slotCapacityRepository;
    private final BookingSettingsService settingsService;
    private final ScheduleResolver scheduleResolver;
    private final CapacityResolver capacityResolver;

    public SlotCapacityAdminService(SlotCapacityRepository slotCapacityRepository,
                                    BookingSettingsService settingsService,
                                    ScheduleResolver scheduleResolver,
                                    CapacityResolver capacityResolver) {
        this.slotCapacityRepository = slotCapacityRepository;
        this.settingsService = settingsService;
        this.scheduleResolver = scheduleResolver;
        this.capacityResolver = capacityResolver;
    }

    @Transactional(readOnly = true)
    public CapacityMatrixView matrix() {
        List<CapacityCell> cells = slotCapacityRepository.findBySpecificDateIsNullOrderByDayOfWeekAscTimeSlotAsc()
                .stream()
                .map(row -> new CapacityCell(row.getDayOfWeek(), row.getTimeSlot(), row.getCapacity()))
                .toList();
        return new CapacityMatrixView(cells, settingsService.snapshot().defaultSlotCapacity());
    }

    @Transactional
    public void updateDefault(Integer capacity) {
        if (capacity == null || capacity < 1) {
            throw new IllegalArgumentException("Capacity must be 1 or more");
        }
        settingsService.put(SettingsSnapshot.KEY_DEFAULT_CAPACITY, capacity, "Default bookings per slot");
        log.info("Default slot capacity set to {}", capacity);
    }

    /**
     * Upserts weekday cells; a cell with a null capacity is removed.
     */
    @Transactional
    public int updateWeekly(List<CapacityCell> cells) {
        if (cells == null) {
            throw new IllegalArgumentException("capacities must be a list");
        }
        for (CapacityCell cell : cells) {
            if (cell.dayOfWeek() == null || cell.dayOfWeek() < 0 || cell.dayOfWeek() > 6) {
                throw new IllegalArgumentException("Invalid day of week: " + cell.dayOfWeek());
            }
            updateWeeklyCell(cell.dayOfWeek(), cell.timeSlot(), cell.capacity());
        }
        log.info("Updated {} weekly capacity cells", cells.size());
        return cells.size();
    }

    @Transactional
    public void updateWeeklyCell(int dayOfWeek, LocalTime timeSlot, Integer capacity) {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("Invalid day of week: " + dayOfWeek);
        }
        LocalTime time = requireTime(timeSlot);
        SlotCapacity existing = slotCapacityRepository
                .findByDayOfWeekAndTimeSlotAndSpecificDateIsNull(dayOfWeek, time).orElse(null);
        if (capacity == null) {
            if (existing != null) {
                slotCapacityRepository.delete(existing);
            }
            return;
        }
        requireCapacity(capacity);
        SlotCapacity row = existing != null ? existing
                : SlotCapacity.builder().dayOfWeek(dayOfWeek).timeSlot(time).build();
        row.setCapacity(capacity);
        slotCapacityRepository.save(row);
    }

    @Transactional(readOnly = true)
    public DateCapacityView dateView(LocalDate date) {
        SettingsSnapshot settings = settingsService.snapshot();
        DayCapacity capacity = capacityResolver.resolveDay(date, settings);
        ResolvedSchedule schedule = scheduleResolver.resolve(date, settings);
        List<TimePeriod> periods = schedule.open() ? schedule.periods() : List.of(FALLBACK_GRID);

        TreeSet<LocalTime> times = new TreeSet<>();
        int step = Math.max(1, settings.slotDurationMinutes());
        for (TimePeriod period : periods) {
            for (LocalTime t = period.open(); t.isBefore(period.close()); t = t.plusMinutes(step)) {
                times.add(t);
                if (t.plusMinutes(step).isBefore(t)) {
                    break;
                }
            }
        }

        List<DateCapacityView.Entry> entries = new ArrayList<>(times.size());
        for (LocalTime t : times) {
            entries.add(new DateCapacityView.Entry(ClinicTime.hourMinute(t), capacity.capacityAt(t), capacity.sourceAt(t)));
        }
        return new DateCapacityView(date, ScheduleResolver.dayOfWeek(date), capacity.defaultCapacity(), entries);
    }

    /**
     * Upserts date-specific cells; a cell with a null capacity falls back to the weekly rule.
     */
    @Transactional
    public int updateDate(LocalDate date, List<CapacityCell> cells) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        if (cells == null) {
            throw new IllegalArgumentException("capacities must be a list");
        }
        for (CapacityCell cell : cells) {
            LocalTime time = requireTime(cell.timeSlot());
            SlotCapacity existing = slotCapacityRepository.findBySpecificDateAndTimeSlot(date, time).orElse(null);
            if (cell.capacity() == null) {
                if (existing != null) {
                    slotCapacityRepository.delete(existing);
                }
                continue;
            }
            requireCapacity(cell.capacity());
            SlotCapacity row = existing != null ? existing
                    : SlotCapacity.builder().specificDate(date).timeSlot(time).build();
            row.setCapacity(cell.capacity());
            slotCapacityRepository.save(row);
        }
        log.info("Saved {} capacity cells for {}", cells.size(), date);
        return cells.size();
    }

    private static LocalTime requireTime(LocalTime timeSlot) {
        if (timeSlot == null) {
            throw new IllegalArgumentException("timeSlot is required");
        }
        return timeSlot.truncatedTo(ChronoUnit.MINUTES);
    }

    private static void requireCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be 1 or more");
        }
    }
}

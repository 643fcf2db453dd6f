package com.clinic.booking.availability;

import com.clinic.booking.entity.SlotCapacity;
import com.clinic.booking.repository.SlotCapacityRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maximum simultaneous bookings for a time of day: a date-specific row wins over
 * a weekday row, which wins over the configured default.
 */
@Component
public class CapacityResolver {

    private final SlotCapacityRepository slotCapacityRepository;

    public CapacityResolver(SlotCapacityRepository slotCapacityRepository) {
        this.slotCapacityRepository = slotCapacityRepository;
    }

    public int resolve(int dayOfWeek, LocalTime time, LocalDate specificDate, SettingsSnapshot settings) {
        LocalTime key = DayCapacity.normalize(time);
        if (specificDate != null) {
            Optional<SlotCapacity> dateRow = slotCapacityRepository.findBySpecificDateAndTimeSlot(specificDate, key);
            if (dateRow.isPresent()) {
                return Math.max(1, dateRow.get().getCapacity());
            }
        }
        return slotCapacityRepository.findByDayOfWeekAndTimeSlotAndSpecificDateIsNull(dayOfWeek, key)
                .map(row -> Math.max(1, row.getCapacity()))
                .orElse(Math.max(1, settings.defaultSlotCapacity()));
    }

    public DayCapacity resolveDay(LocalDate date, SettingsSnapshot settings) {
        return new DayCapacity(
                byTime(slotCapacityRepository.findBySpecificDate(date)),
                byTime(slotCapacityRepository.findByDayOfWeekAndSpecificDateIsNull(ScheduleResolver.dayOfWeek(date))),
                settings.defaultSlotCapacity());
    }

    private static Map<LocalTime, Integer> byTime(List<SlotCapacity> rows) {
        Map<LocalTime, Integer> map = new HashMap<>();
        for (SlotCapacity row : rows) {
            if (row.getTimeSlot() != null) {
                map.put(DayCapacity.normalize(row.getTimeSlot()), row.getCapacity());
            }
        }
        return map;
    }
}

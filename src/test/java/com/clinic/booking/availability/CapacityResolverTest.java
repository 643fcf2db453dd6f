package com.clinic.booking.availability;

import com.clinic.booking.entity.SlotCapacity;
import com.clinic.booking.repository.SlotCapacityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class CapacityResolverTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 6, 3);
    private static final LocalTime NINE = LocalTime.of(9, 0);

    private SlotCapacityRepository repository;
    private CapacityResolver resolver;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(SlotCapacityRepository.class);
        resolver = new CapacityResolver(repository);
    }

    private static SettingsSnapshot withDefaultCapacity(int capacity) {
        SettingsSnapshot d = SettingsSnapshot.defaults();
        return new SettingsSnapshot(d.cutoffDays(), d.cutoffHours(), d.maxDaysAhead(), d.slotDurationMinutes(),
                capacity, d.lunchStart(), d.lunchEnd());
    }

    @Test
    void fallsBackToConfiguredDefault() {
        assertThat(resolver.resolve(1, NINE, MONDAY, withDefaultCapacity(2))).isEqualTo(2);
    }

    @Test
    void weekdayRowBeatsDefault() {
        when(repository.findByDayOfWeekAndTimeSlotAndSpecificDateIsNull(1, NINE))
                .thenReturn(Optional.of(SlotCapacity.builder().dayOfWeek(1).timeSlot(NINE).capacity(3).build()));

        assertThat(resolver.resolve(1, NINE, MONDAY, withDefaultCapacity(2))).isEqualTo(3);
    }

    @Test
    void dateRowBeatsWeekdayRow() {
        when(repository.findByDayOfWeekAndTimeSlotAndSpecificDateIsNull(1, NINE))
                .thenReturn(Optional.of(SlotCapacity.builder().dayOfWeek(1).timeSlot(NINE).capacity(3).build()));
        when(repository.findBySpecificDateAndTimeSlot(MONDAY, NINE))
                .thenReturn(Optional.of(SlotCapacity.builder().specificDate(MONDAY).timeSlot(NINE).capacity(6).build()));

        assertThat(resolver.resolve(1, NINE, MONDAY, withDefaultCapacity(1))).isEqualTo(6);
    }

    @Test
    void secondsAreDroppedBeforeLookup() {
        when(repository.findByDayOfWeekAndTimeSlotAndSpecificDateIsNull(1, NINE))
                .thenReturn(Optional.of(SlotCapacity.builder().dayOfWeek(1).timeSlot(NINE).capacity(4).build()));

        assertThat(resolver.resolve(1, LocalTime.of(9, 0, 42), null, withDefaultCapacity(1))).isEqualTo(4);
    }

    @Test
    void dayLookupReportsWhereEachValueCameFrom() {
        when(repository.findByDayOfWeekAndSpecificDateIsNull(1)).thenReturn(List.of(
                SlotCapacity.builder().dayOfWeek(1).timeSlot(NINE).capacity(3).build(),
                SlotCapacity.builder().dayOfWeek(1).timeSlot(LocalTime.of(9, 30)).capacity(2).build()));
        when(repository.findBySpecificDate(MONDAY)).thenReturn(List.of(
                SlotCapacity.builder().specificDate(MONDAY).timeSlot(LocalTime.of(9, 30)).capacity(5).build()));

        DayCapacity day = resolver.resolveDay(MONDAY, withDefaultCapacity(1));

        assertThat(day.capacityAt(NINE)).isEqualTo(3);
        assertThat(day.sourceAt(NINE)).isEqualTo(DayCapacity.SOURCE_DAY);
        assertThat(day.capacityAt(LocalTime.of(9, 30))).isEqualTo(5);
        assertThat(day.sourceAt(LocalTime.of(9, 30))).isEqualTo(DayCapacity.SOURCE_DATE);
        assertThat(day.capacityAt(LocalTime.of(10, 0))).isEqualTo(1);
        assertThat(day.sourceAt(LocalTime.of(10, 0))).isEqualTo(DayCapacity.SOURCE_DEFAULT);
    }
}

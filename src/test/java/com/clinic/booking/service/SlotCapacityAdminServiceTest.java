package com.clinic.booking.service;

import com.clinic.booking.availability.CapacityResolver;
import com.clinic.booking.availability.ScheduleResolver;
import com.clinic.booking.availability.SettingsSnapshot;
import com.clinic.booking.dto.CapacityCell;
import com.clinic.booking.dto.DateCapacityView;
import com.clinic.booking.entity.BusinessHours;
import com.clinic.booking.entity.SlotCapacity;
import com.clinic.booking.repository.BusinessHoursRepository;
import com.clinic.booking.repository.HolidayRepository;
import com.clinic.booking.repository.ScheduleExceptionRepository;
import com.clinic.booking.repository.SlotCapacityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SlotCapacityAdminServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 6, 3);
    private static final LocalDate SUNDAY = LocalDate.of(2030, 6, 2);

    private SlotCapacityRepository slotCapacityRepository;
    private BusinessHoursRepository businessHoursRepository;
    private BookingSettingsService settingsService;
    private SlotCapacityAdminService service;

    @BeforeEach
    void setUp() {
        slotCapacityRepository = Mockito.mock(SlotCapacityRepository.class);
        businessHoursRepository = Mockito.mock(BusinessHoursRepository.class);
        settingsService = Mockito.mock(BookingSettingsService.class);
        ScheduleResolver scheduleResolver = new ScheduleResolver(businessHoursRepository,
                Mockito.mock(HolidayRepository.class), Mockito.mock(ScheduleExceptionRepository.class));
        service = new SlotCapacityAdminService(slotCapacityRepository, settingsService, scheduleResolver,
                new CapacityResolver(slotCapacityRepository));

        when(settingsService.snapshot()).thenReturn(new SettingsSnapshot(2, 3, 60, 60, 2,
                LocalTime.of(12, 0), LocalTime.of(13, 0)));
        when(businessHoursRepository.findByDayOfWeek(1)).thenReturn(Optional.of(BusinessHours.builder()
                .dayOfWeek(1)
                .morningOpen(LocalTime.of(9, 0)).morningClose(LocalTime.of(12, 0))
                .afternoonOpen(LocalTime.of(13, 0)).afternoonClose(LocalTime.of(15, 0))
                .build()));
        when(businessHoursRepository.findByDayOfWeek(0)).thenReturn(Optional.of(
                BusinessHours.builder().dayOfWeek(0).closed(true).build()));
    }

    @Test
    void dateViewReportsWhichLayerEachCapacityCameFrom() {
        when(slotCapacityRepository.findByDayOfWeekAndSpecificDateIsNull(1)).thenReturn(List.of(
                SlotCapacity.builder().dayOfWeek(1).timeSlot(LocalTime.of(10, 0)).capacity(3).build()));
        when(slotCapacityRepository.findBySpecificDate(MONDAY)).thenReturn(List.of(
                SlotCapacity.builder().specificDate(MONDAY).timeSlot(LocalTime.of(13, 0)).capacity(5).build()));

        DateCapacityView view = service.dateView(MONDAY);

        assertThat(view.dayOfWeek()).isEqualTo(1);
        assertThat(view.defaultCapacity()).isEqualTo(2);
        assertThat(view.capacities()).containsExactly(
                new DateCapacityView.Entry("09:00", 2, "default"),
                new DateCapacityView.Entry("10:00", 3, "day"),
                new DateCapacityView.Entry("11:00", 2, "default"),
                new DateCapacityView.Entry("13:00", 5, "date"),
                new DateCapacityView.Entry("14:00", 2, "default"));
    }

    @Test
    void closedDateStillShowsAnEditableGrid() {
        DateCapacityView view = service.dateView(SUNDAY);

        assertThat(view.capacities()).hasSize(10);
        assertThat(view.capacities().get(0).timeSlot()).isEqualTo("09:00");
        assertThat(view.capacities().get(9).timeSlot()).isEqualTo("18:00");
    }

    @Test
    void nullCapacityRemovesTheDateOverride() {
        SlotCapacity existing = SlotCapacity.builder().id(4L).specificDate(MONDAY).timeSlot(LocalTime.of(9, 0)).capacity(4).build();
        when(slotCapacityRepository.findBySpecificDateAndTimeSlot(MONDAY, LocalTime.of(9, 0))).thenReturn(Optional.of(existing));

        service.updateDate(MONDAY, Arrays.asList(
                new CapacityCell(null, LocalTime.of(9, 0), null),
                new CapacityCell(null, LocalTime.of(10, 0), 6)));

        verify(slotCapacityRepository).delete(existing);
        ArgumentCaptor<SlotCapacity> saved = ArgumentCaptor.forClass(SlotCapacity.class);
        verify(slotCapacityRepository).save(saved.capture());
        assertThat(saved.getValue().getSpecificDate()).isEqualTo(MONDAY);
        assertThat(saved.getValue().getTimeSlot()).isEqualTo(LocalTime.of(10, 0));
        assertThat(saved.getValue().getCapacity()).isEqualTo(6);
    }

    @Test
    void weeklyCellRejectsCapacityBelowOne() {
        assertThatThrownBy(() -> service.updateWeeklyCell(1, LocalTime.of(9, 0), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Capacity must be 1 or more");
        verify(slotCapacityRepository, never()).save(any());
    }

    @Test
    void weeklyBulkRejectsAnInvalidWeekday() {
        assertThatThrownBy(() -> service.updateWeekly(List.of(new CapacityCell(7, LocalTime.of(9, 0), 2))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid day of week: 7");
    }
}

package com.clinic.booking.service;

import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.dto.BusinessHoursRequest;
import com.clinic.booking.dto.HolidayRequest;
import com.clinic.booking.dto.ScheduleExceptionRequest;
import com.clinic.booking.entity.Appointment;
import com.clinic.booking.entity.BusinessHours;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Patient;
import com.clinic.booking.entity.ScheduleException;
import com.clinic.booking.entity.ScheduleExceptionType;
import com.clinic.booking.repository.AppointmentRepository;
import com.clinic.booking.repository.BusinessHoursRepository;
import com.clinic.booking.repository.HolidayRepository;
import com.clinic.booking.repository.ScheduleExceptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduleAdminServiceTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
    private static final LocalDate MONDAY = LocalDate.of(2030, 6, 3);

    private BusinessHoursRepository businessHoursRepository;
    private HolidayRepository holidayRepository;
    private ScheduleExceptionRepository exceptionRepository;
    private AppointmentRepository appointmentRepository;
    private ScheduleAdminService service;

    @BeforeEach
    void setUp() {
        businessHoursRepository = Mockito.mock(BusinessHoursRepository.class);
        holidayRepository = Mockito.mock(HolidayRepository.class);
        exceptionRepository = Mockito.mock(ScheduleExceptionRepository.class);
        appointmentRepository = Mockito.mock(AppointmentRepository.class);
        service = new ScheduleAdminService(Clock.fixed(Instant.parse("2030-05-20T00:00:00Z"), TOKYO),
                businessHoursRepository, holidayRepository, exceptionRepository, appointmentRepository);
        when(exceptionRepository.save(any(ScheduleException.class))).thenAnswer(inv -> inv.getArgument(0));
        when(businessHoursRepository.save(any(BusinessHours.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void closingAWeekdayClearsItsPairs() {
        BusinessHours monday = BusinessHours.builder().dayOfWeek(1)
                .morningOpen(LocalTime.of(9, 0)).morningClose(LocalTime.of(12, 0)).build();
        when(businessHoursRepository.findByDayOfWeek(1)).thenReturn(Optional.of(monday));
        BusinessHoursRequest request = new BusinessHoursRequest();
        request.setClosed(true);

        BusinessHours saved = service.updateBusinessHours(1, request);

        assertThat(saved.isClosed()).isTrue();
        assertThat(saved.getMorningOpen()).isNull();
    }

    @Test
    void reversedPairIsRejected() {
        when(businessHoursRepository.findByDayOfWeek(1)).thenReturn(Optional.of(BusinessHours.builder().dayOfWeek(1).build()));
        BusinessHoursRequest request = new BusinessHoursRequest();
        request.setMorningOpen(LocalTime.of(12, 0));
        request.setMorningClose(LocalTime.of(9, 0));

        assertThatThrownBy(() -> service.updateBusinessHours(1, request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("morning close must be after morning open");
    }

    @Test
    void duplicateHolidayIsRejected() {
        when(holidayRepository.existsByDate(MONDAY)).thenReturn(true);
        HolidayRequest request = new HolidayRequest();
        request.setDate(MONDAY);

        assertThatThrownBy(() -> service.createHoliday(request)).isInstanceOf(IllegalArgumentException.class);
        verify(holidayRepository, never()).save(any());
    }

    @Test
    void partialClosureNeedsAnOrderedTimeRange() {
        ScheduleExceptionRequest request = new ScheduleExceptionRequest();
        request.setType(ScheduleExceptionType.PARTIAL_CLOSED);
        request.setStartDate(MONDAY);
        request.setEndDate(MONDAY);
        request.setStartTime(LocalTime.of(15, 0));
        request.setEndTime(LocalTime.of(14, 0));

        assertThatThrownBy(() -> service.createException(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Partial closure requires startTime before endTime");
    }

    @Test
    void exceptionIsStoredWithTrimmedReason() {
        ScheduleExceptionRequest request = new ScheduleExceptionRequest();
        request.setType(ScheduleExceptionType.CLOSED);
        request.setStartDate(MONDAY);
        request.setEndDate(MONDAY.plusDays(2));
        request.setReason("  Staff training ");

        ScheduleException saved = service.createException(request);

        assertThat(saved.getReason()).isEqualTo("Staff training");
        assertThat(saved.covers(MONDAY.plusDays(1))).isTrue();
    }

    @Test
    void affectedAppointmentsAreNarrowedToTheTimeRange() {
        Appointment morning = appointmentAt(MONDAY.atTime(10, 0));
        Appointment afternoon = appointmentAt(MONDAY.atTime(14, 30));
        when(appointmentRepository.findByStartAtGreaterThanEqualAndStartAtLessThanAndStatusOrderByStartAtAsc(
                eq(MONDAY.atStartOfDay(TOKYO).toInstant()), eq(MONDAY.plusDays(1).atStartOfDay(TOKYO).toInstant()),
                eq(Appointment.Status.CONFIRMED)))
                .thenReturn(List.of(morning, afternoon));

        List<AppointmentView> affected = service.affectedAppointments(MONDAY, MONDAY, LocalTime.of(14, 0), LocalTime.of(15, 0));

        assertThat(affected).extracting(AppointmentView::id).containsExactly(afternoon.getId());
        assertThat(service.affectedAppointments(MONDAY, MONDAY, null, null)).hasSize(2);
    }

    private static Appointment appointmentAt(LocalDateTime local) {
        Instant start = local.atZone(TOKYO).toInstant();
        return Appointment.builder()
                .id((long) local.getHour())
                .patient(Patient.builder().id(1L).name("Hanako Sato").phone("0312345678").build())
                .service(ClinicService.builder().id(1L).name("Check-up").build())
                .startAt(start)
                .endAt(start.plus(Duration.ofMinutes(30)))
                .build();
    }
}

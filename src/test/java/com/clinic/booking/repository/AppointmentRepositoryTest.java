package com.clinic.booking.repository;

import com.clinic.booking.entity.Appointment;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Patient;
import com.clinic.booking.entity.Staff;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class AppointmentRepositoryTest {

    private static final Instant TEN = Instant.parse("2030-06-03T01:00:00Z");
    private static final Duration HALF_HOUR = Duration.ofMinutes(30);

    @Autowired
    TestEntityManager entityManager;

    @Autowired
    AppointmentRepository appointmentRepository;

    private Patient patient;
    private ClinicService service;
    private Staff tanaka;
    private Staff suzuki;

    @BeforeEach
    void setUp() {
        patient = entityManager.persist(Patient.builder().name("Hanako Sato").kana("hanako").phone("0312345678").build());
        service = entityManager.persist(ClinicService.builder().name("Check-up").durationMinutes(30).build());
        tanaka = entityManager.persist(Staff.builder().name("Tanaka").build());
        suzuki = entityManager.persist(Staff.builder().name("Suzuki").build());
    }

    private Appointment book(Instant start, Staff staff, Appointment.Status status, String tokenHash) {
        return entityManager.persist(Appointment.builder()
                .patient(patient)
                .service(service)
                .staff(staff)
                .startAt(start)
                .endAt(start.plus(HALF_HOUR))
                .status(status)
                .accessTokenHash(tokenHash)
                .tokenExpiresAt(start.plus(Duration.ofDays(30)))
                .build());
    }

    @Test
    void overlapUsesHalfOpenIntervals() {
        book(TEN, null, Appointment.Status.CONFIRMED, "a");

        assertThat(appointmentRepository.countOverlapping(TEN, TEN.plus(HALF_HOUR), Appointment.Status.CONFIRMED)).isEqualTo(1);
        assertThat(appointmentRepository.countOverlapping(TEN.plus(HALF_HOUR), TEN.plus(HALF_HOUR).plus(HALF_HOUR),
                Appointment.Status.CONFIRMED)).isZero();
        assertThat(appointmentRepository.countOverlapping(TEN.minus(HALF_HOUR), TEN, Appointment.Status.CONFIRMED)).isZero();
        assertThat(appointmentRepository.countOverlapping(TEN.plus(Duration.ofMinutes(15)), TEN.plus(Duration.ofMinutes(45)),
                Appointment.Status.CONFIRMED)).isEqualTo(1);
    }

    @Test
    void cancelledAppointmentsDoNotCount() {
        book(TEN, null, Appointment.Status.CANCELLED, "a");

        assertThat(appointmentRepository.countOverlapping(TEN, TEN.plus(HALF_HOUR), Appointment.Status.CONFIRMED)).isZero();
    }

    @Test
    void staffCountIncludesUnassignedButNotOtherStaff() {
        book(TEN, null, Appointment.Status.CONFIRMED, "a");
        book(TEN, suzuki, Appointment.Status.CONFIRMED, "b");

        assertThat(appointmentRepository.countOverlappingForStaff(TEN, TEN.plus(HALF_HOUR), tanaka.getId(),
                Appointment.Status.CONFIRMED)).isEqualTo(1);
        assertThat(appointmentRepository.countOverlappingForStaff(TEN, TEN.plus(HALF_HOUR), suzuki.getId(),
                Appointment.Status.CONFIRMED)).isEqualTo(2);
        assertThat(appointmentRepository.countOverlapping(TEN, TEN.plus(HALF_HOUR), Appointment.Status.CONFIRMED)).isEqualTo(2);
    }

    @Test
    void excludingCountLeavesTheGivenAppointmentOut() {
        Appointment own = book(TEN, tanaka, Appointment.Status.CONFIRMED, "a");
        book(TEN, null, Appointment.Status.CONFIRMED, "b");

        assertThat(appointmentRepository.countOverlappingExcluding(TEN, TEN.plus(HALF_HOUR),
                Appointment.Status.CONFIRMED, own.getId())).isEqualTo(1);
        assertThat(appointmentRepository.countOverlappingForStaffExcluding(TEN, TEN.plus(HALF_HOUR), tanaka.getId(),
                Appointment.Status.CONFIRMED, own.getId())).isEqualTo(1);
        assertThat(appointmentRepository.countOverlappingForStaffExcluding(TEN, TEN.plus(HALF_HOUR), suzuki.getId(),
                Appointment.Status.CONFIRMED, own.getId())).isEqualTo(1);
    }

    @Test
    void findOverlappingLoadsTheWholeDay() {
        book(TEN, tanaka, Appointment.Status.CONFIRMED, "a");
        book(TEN.plus(Duration.ofHours(3)), null, Appointment.Status.CONFIRMED, "b");
        book(TEN.plus(Duration.ofDays(1)), null, Appointment.Status.CONFIRMED, "c");
        entityManager.flush();
        entityManager.clear();

        assertThat(appointmentRepository.findOverlapping(TEN.minus(Duration.ofHours(1)), TEN.plus(Duration.ofHours(12)),
                Appointment.Status.CONFIRMED))
                .hasSize(2)
                .anySatisfy(a -> assertThat(a.getStaff().getName()).isEqualTo("Tanaka"));
    }

    @Test
    void tokenLookupIgnoresExpiredTokens() {
        book(TEN, null, Appointment.Status.CONFIRMED, "hash-1");

        assertThat(appointmentRepository.findByAccessTokenHashAndTokenExpiresAtAfter("hash-1", TEN)).isPresent();
        assertThat(appointmentRepository.findByAccessTokenHashAndTokenExpiresAtAfter("hash-1",
                TEN.plus(Duration.ofDays(31)))).isEmpty();
        assertThat(appointmentRepository.findByAccessTokenHashAndTokenExpiresAtAfter("other", TEN)).isEmpty();
    }
}

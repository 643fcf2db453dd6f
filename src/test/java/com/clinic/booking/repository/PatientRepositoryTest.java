package com.clinic.booking.repository;

import com.clinic.booking.entity.Appointment;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Patient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PatientRepositoryTest {

    private static final Instant TEN = Instant.parse("2030-06-03T01:00:00Z");

    @Autowired
    TestEntityManager entityManager;

    @Autowired
    PatientRepository patientRepository;

    @Autowired
    AppointmentRepository appointmentRepository;

    private Patient hanako;
    private Patient taro;
    private ClinicService service;

    @BeforeEach
    void setUp() {
        hanako = entityManager.persist(Patient.builder().name("Hanako Sato").kana("sato hanako").phone("0312345678")
                .email("hanako@example.com").createdAt(TEN.minus(Duration.ofDays(5))).build());
        taro = entityManager.persist(Patient.builder().name("Taro Ito").kana("ito taro").phone("0398765432")
                .createdAt(TEN.minus(Duration.ofDays(1))).build());
        service = entityManager.persist(ClinicService.builder().name("Check-up").durationMinutes(30).build());
    }

    private void visit(Patient patient, Instant start, Appointment.Status status) {
        entityManager.persist(Appointment.builder()
                .patient(patient)
                .service(service)
                .startAt(start)
                .endAt(start.plus(Duration.ofMinutes(30)))
                .status(status)
                .accessTokenHash("h" + start.getEpochSecond() + patient.getId())
                .tokenExpiresAt(start.plus(Duration.ofDays(30)))
                .build());
    }

    @Test
    void searchMatchesAnyContactFieldNewestFirst() {
        assertThat(patientRepository.search("%sato%", PageRequest.of(0, 100))).containsExactly(hanako);
        assertThat(patientRepository.search("%example.com%", PageRequest.of(0, 100))).containsExactly(hanako);
        assertThat(patientRepository.search("%03%", PageRequest.of(0, 100))).containsExactly(taro, hanako);
        assertThat(patientRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, 1))).containsExactly(taro);
    }

    @Test
    void visitsAreSummarizedPerPatientOverEveryStatus() {
        visit(hanako, TEN, Appointment.Status.CONFIRMED);
        visit(hanako, TEN.plus(Duration.ofDays(7)), Appointment.Status.CANCELLED);
        entityManager.flush();

        List<AppointmentRepository.PatientVisits> rows = appointmentRepository.summarizeVisits(List.of(hanako.getId(), taro.getId()));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getPatientId()).isEqualTo(hanako.getId());
        assertThat(rows.get(0).getAppointmentCount()).isEqualTo(2);
        assertThat(rows.get(0).getLastVisit()).isEqualTo(TEN.plus(Duration.ofDays(7)));
    }

    @Test
    void historyIsNewestFirst() {
        visit(hanako, TEN, Appointment.Status.CONFIRMED);
        visit(hanako, TEN.plus(Duration.ofDays(7)), Appointment.Status.COMPLETED);
        entityManager.flush();
        entityManager.clear();

        assertThat(appointmentRepository.findHistory(hanako.getId()))
                .extracting(Appointment::getStartAt)
                .containsExactly(TEN.plus(Duration.ofDays(7)), TEN);
        assertThat(appointmentRepository.existsByServiceId(service.getId())).isTrue();
    }
}

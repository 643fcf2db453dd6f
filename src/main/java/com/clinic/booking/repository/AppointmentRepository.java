package com.clinic.booking.repository;

import com.clinic.booking.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    /** Per-patient totals over every status. */
    interface PatientVisits {
        Long getPatientId();

        long getAppointmentCount();

        Instant getLastVisit();
    }

    /**
     * Appointments in the given status whose [startAt, endAt) intersects [from, to).
     */
    @Query("SELECT a FROM Appointment a LEFT JOIN FETCH a.staff "
            + "WHERE a.status = :status AND a.startAt < :to AND a.endAt > :from")
    List<Appointment> findOverlapping(@Param("from") Instant from,
                                      @Param("to") Instant to,
                                      @Param("status") Appointment.Status status);

    @Query("SELECT COUNT(a) FROM Appointment a "
            + "WHERE a.status = :status AND a.startAt < :to AND a.endAt > :from")
    long countOverlapping(@Param("from") Instant from,
                          @Param("to") Instant to,
                          @Param("status") Appointment.Status status);

    /**
     * Same as {@link #countOverlapping} but limited to one staff member,
     * counting unstaffed appointments as well.
     */
    @Query("SELECT COUNT(a) FROM Appointment a LEFT JOIN a.staff s "
            + "WHERE a.status = :status AND a.startAt < :to AND a.endAt > :from "
            + "AND (s IS NULL OR s.id = :staffId)")
    long countOverlappingForStaff(@Param("from") Instant from,
                                  @Param("to") Instant to,
                                  @Param("staffId") Long staffId,
                                  @Param("status") Appointment.Status status);

    /**
     * Overlap counts that leave one appointment out, for re-checking a row that
     * is about to become confirmed again.
     */
    @Query("SELECT COUNT(a) FROM Appointment a "
            + "WHERE a.status = :status AND a.startAt < :to AND a.endAt > :from AND a.id <> :excludedId")
    long countOverlappingExcluding(@Param("from") Instant from,
                                   @Param("to") Instant to,
                                   @Param("status") Appointment.Status status,
                                   @Param("excludedId") Long excludedId);

    @Query("SELECT COUNT(a) FROM Appointment a LEFT JOIN a.staff s "
            + "WHERE a.status = :status AND a.startAt < :to AND a.endAt > :from "
            + "AND (s IS NULL OR s.id = :staffId) AND a.id <> :excludedId")
    long countOverlappingForStaffExcluding(@Param("from") Instant from,
                                           @Param("to") Instant to,
                                           @Param("staffId") Long staffId,
                                           @Param("status") Appointment.Status status,
                                           @Param("excludedId") Long excludedId);

    Optional<Appointment> findByAccessTokenHashAndTokenExpiresAtAfter(String accessTokenHash, Instant now);

    List<Appointment> findByStartAtGreaterThanEqualAndStartAtLessThanOrderByStartAtAsc(Instant from, Instant to);

    List<Appointment> findByStartAtGreaterThanEqualAndStartAtLessThanAndStatusOrderByStartAtAsc(
            Instant from, Instant to, Appointment.Status status);

    boolean existsByServiceId(Long serviceId);

    @Query("SELECT a FROM Appointment a JOIN FETCH a.service LEFT JOIN FETCH a.staff "
            + "WHERE a.patient.id = :patientId ORDER BY a.startAt DESC")
    List<Appointment> findHistory(@Param("patientId") Long patientId);

    @Query("SELECT a.patient.id AS patientId, COUNT(a) AS appointmentCount, MAX(a.startAt) AS lastVisit "
            + "FROM Appointment a WHERE a.patient.id IN :patientIds GROUP BY a.patient.id")
    List<PatientVisits> summarizeVisits(@Param("patientIds") Collection<Long> patientIds);
}

package com.clinic.booking.repository;

import com.clinic.booking.entity.ScheduleException;
import com.clinic.booking.entity.ScheduleExceptionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ScheduleExceptionRepository extends JpaRepository<ScheduleException, Long> {

    @Query("SELECT e FROM ScheduleException e WHERE e.startDate <= :date AND e.endDate >= :date")
    List<ScheduleException> findCovering(@Param("date") LocalDate date);

    @Query("SELECT e FROM ScheduleException e WHERE e.startDate <= :to AND e.endDate >= :from "
            + "ORDER BY e.startDate ASC, e.startTime ASC")
    List<ScheduleException> findOverlappingRange(@Param("from") LocalDate from, @Param("to") LocalDate to);

    List<ScheduleException> findAllByOrderByStartDateAscStartTimeAsc();

    List<ScheduleException> findByTypeOrderByStartDateAscStartTimeAsc(ScheduleExceptionType type);
}

package com.clinic.booking.repository;

import com.clinic.booking.entity.Holiday;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface HolidayRepository extends JpaRepository<Holiday, Long> {

    Optional<Holiday> findByDate(LocalDate date);

    boolean existsByDate(LocalDate date);

    List<Holiday> findByDateBetween(LocalDate from, LocalDate to);

    List<Holiday> findAllByOrderByDateAsc();
}

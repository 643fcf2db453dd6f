package com.clinic.booking.repository;

import com.clinic.booking.entity.SlotCapacity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SlotCapacityRepository extends JpaRepository<SlotCapacity, Long> {

    Optional<SlotCapacity> findBySpecificDateAndTimeSlot(LocalDate specificDate, LocalTime timeSlot);

    Optional<SlotCapacity> findByDayOfWeekAndTimeSlotAndSpecificDateIsNull(Integer dayOfWeek, LocalTime timeSlot);

    List<SlotCapacity> findByDayOfWeekAndSpecificDateIsNull(Integer dayOfWeek);

    List<SlotCapacity> findBySpecificDate(LocalDate specificDate);

    List<SlotCapacity> findBySpecificDateIsNullOrderByDayOfWeekAscTimeSlotAsc();
}

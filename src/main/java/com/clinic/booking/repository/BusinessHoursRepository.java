package com.clinic.booking.repository;

import com.clinic.booking.entity.BusinessHours;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface BusinessHoursRepository extends JpaRepository<BusinessHours, Long> {

    Optional<BusinessHours> findByDayOfWeek(int dayOfWeek);

    List<BusinessHours> findAllByOrderByDayOfWeekAsc();

    /**
     * Row lock used to serialize bookings that fall on the same weekday.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BusinessHours b WHERE b.dayOfWeek = :dayOfWeek")
    Optional<BusinessHours> findByDayOfWeekForUpdate(@Param("dayOfWeek") int dayOfWeek);
}

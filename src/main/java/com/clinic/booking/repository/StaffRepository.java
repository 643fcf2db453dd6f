package com.clinic.booking.repository;

import com.clinic.booking.entity.Staff;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StaffRepository extends JpaRepository<Staff, Long> {

    Optional<Staff> findByIdAndActiveTrue(Long id);

    List<Staff> findByActiveTrueOrderBySortOrderAscIdAsc();
}

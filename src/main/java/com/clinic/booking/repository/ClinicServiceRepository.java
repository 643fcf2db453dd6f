package com.clinic.booking.repository;

import com.clinic.booking.entity.ClinicService;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ClinicServiceRepository extends JpaRepository<ClinicService, Long> {

    Optional<ClinicService> findByIdAndActiveTrue(Long id);

    List<ClinicService> findByActiveTrueOrderBySortOrderAscIdAsc();

    List<ClinicService> findAllByOrderBySortOrderAscIdAsc();
}

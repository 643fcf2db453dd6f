package com.clinic.booking.repository;

import com.clinic.booking.entity.Patient;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PatientRepository extends JpaRepository<Patient, Long> {

    Optional<Patient> findFirstByPhoneOrderByIdAsc(String phone);

    Optional<Patient> findFirstByPhoneOrEmailOrderByIdAsc(String phone, String email);

    List<Patient> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    /**
     * Newest first. {@code pattern} is a lower-case LIKE pattern matched against
     * name, kana, phone and email.
     */
    @Query("SELECT p FROM Patient p "
            + "WHERE LOWER(p.name) LIKE :pattern OR LOWER(p.kana) LIKE :pattern "
            + "OR p.phone LIKE :pattern OR LOWER(p.email) LIKE :pattern "
            + "ORDER BY p.createdAt DESC, p.id DESC")
    List<Patient> search(@Param("pattern") String pattern, Pageable pageable);
}

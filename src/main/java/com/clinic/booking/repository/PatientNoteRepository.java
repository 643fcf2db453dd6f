package com.clinic.booking.repository;

import com.clinic.booking.entity.PatientNote;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PatientNoteRepository extends JpaRepository<PatientNote, Long> {

    List<PatientNote> findByPatientIdOrderByCreatedAtDescIdDesc(Long patientId);
}

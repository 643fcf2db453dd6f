package com.clinic.booking.service;

import com.clinic.booking.dto.AppointmentView;
import com.clinic.booking.dto.PatientDetail;
import com.clinic.booking.dto.PatientSummary;
import com.clinic.booking.entity.Patient;
import com.clinic.booking.entity.PatientNote;
import com.clinic.booking.exception.ResourceNotFoundException;
import com.clinic.booking.repository.AppointmentRepository;
import com.clinic.booking.repository.PatientNoteRepository;
import com.clinic.booking.repository.PatientRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Patient list, history and staff memos for the reception screen.
 */
@Service
public class PatientAdminService {

    private static final Logger log = LoggerFactory.getLogger(PatientAdminService.class);

    static final int LIST_LIMIT = 100;

    private final Clock clock;
    private final PatientRepository patientRepository;
    private final PatientNoteRepository noteRepository;
    private final AppointmentRepository appointmentRepository;

    public PatientAdminService(Clock clock,
                               PatientRepository patientRepository,
                               PatientNoteRepository noteRepository,
                               AppointmentRepository appointmentRepository) {
        this.clock = clock;
        this.patientRepository = patientRepository;
        this.noteRepository = noteRepository;
        this.appointmentRepository = appointmentRepository;
    }

    /**
     * Newest patients first, at most {@value #LIST_LIMIT}, optionally narrowed to
     * those whose name, kana, phone or email contains {@code search}.
     */
    @Transactional(readOnly = true)
    public List<PatientSummary> list(String search) {
        PageRequest page = PageRequest.of(0, LIST_LIMIT);
        List<Patient> patients = StringUtils.isBlank(search)
                ? patientRepository.findAllByOrderByCreatedAtDescIdDesc(page)
                : patientRepository.search("%" + search.trim().toLowerCase(Locale.ROOT) + "%", page);
        if (patients.isEmpty()) {
            return List.of();
        }
        Map<Long, AppointmentRepository.PatientVisits> visits = appointmentRepository
                .summarizeVisits(patients.stream().map(Patient::getId).toList()).stream()
                .collect(Collectors.toMap(AppointmentRepository.PatientVisits::getPatientId, Function.identity()));
        ZoneId zone = clock.getZone();
        return patients.stream().map(p -> {
            AppointmentRepository.PatientVisits v = visits.get(p.getId());
            return v == null
                    ? PatientSummary.of(p, 0, null, zone)
                    : PatientSummary.of(p, v.getAppointmentCount(), v.getLastVisit(), zone);
        }).toList();
    }

    @Transactional(readOnly = true)
    public PatientDetail get(Long id) {
        Patient patient = require(id);
        ZoneId zone = clock.getZone();
        List<AppointmentView> appointments = appointmentRepository.findHistory(id).stream()
                .map(a -> AppointmentView.of(a, zone))
                .toList();
        List<PatientDetail.Note> notes = noteRepository.findByPatientIdOrderByCreatedAtDescIdDesc(id).stream()
                .map(n -> PatientDetail.Note.of(n, zone))
                .toList();
        return PatientDetail.of(patient, appointments, notes, zone);
    }

    @Transactional
    public PatientDetail.Note addNote(Long id, String note) {
        if (StringUtils.isBlank(note)) {
            throw new IllegalArgumentException("note is required");
        }
        Patient patient = require(id);
        PatientNote saved = noteRepository.save(PatientNote.builder()
                .patient(patient)
                .note(note.trim())
                .createdAt(clock.instant())
                .build());
        log.info("Added note {} to patient {}", saved.getId(), id);
        return PatientDetail.Note.of(saved, clock.getZone());
    }

    private Patient require(Long id) {
        return patientRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Patient not found: " + id));
    }
}

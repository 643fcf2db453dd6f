package com.clinic.booking.controller;

import com.clinic.booking.dto.PatientDetail;
import com.clinic.booking.dto.PatientNoteRequest;
import com.clinic.booking.dto.PatientSummary;
import com.clinic.booking.service.PatientAdminService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/patients")
public class AdminPatientController {

    private final PatientAdminService patientAdminService;

    public AdminPatientController(PatientAdminService patientAdminService) {
        this.patientAdminService = patientAdminService;
    }

    @GetMapping
    public List<PatientSummary> list(@RequestParam(required = false) String search) {
        return patientAdminService.list(search);
    }

    @GetMapping("/{id}")
    public PatientDetail detail(@PathVariable Long id) {
        return patientAdminService.get(id);
    }

    @PostMapping("/{id}/notes")
    @ResponseStatus(HttpStatus.CREATED)
    public PatientDetail.Note addNote(@PathVariable Long id, @Valid @RequestBody PatientNoteRequest request) {
        return patientAdminService.addNote(id, request.getNote());
    }
}

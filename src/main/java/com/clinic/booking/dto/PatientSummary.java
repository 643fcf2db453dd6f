package com.clinic.booking.dto;

import com.clinic.booking.availability.ClinicTime;
import com.clinic.booking.entity.Patient;

import java.time.Instant;
import java.time.ZoneId;

/**
 * One row of the patient list, with how often and how recently the patient booked.
 */
public record PatientSummary(Long id,
                             String name,
                             String kana,
                             String phone,
                             String email,
                             String createdAt,
                             long appointmentCount,
                             String lastVisit) {

    public static PatientSummary of(Patient p, long appointmentCount, Instant lastVisit, ZoneId zone) {
        return new PatientSummary(p.getId(), p.getName(), p.getKana(), p.getPhone(), p.getEmail(),
                ClinicTime.format(p.getCreatedAt(), zone),
                appointmentCount,
                lastVisit == null ? null : ClinicTime.format(lastVisit, zone));
    }
}

package com.clinic.booking.dto;

import com.clinic.booking.availability.ClinicTime;
import com.clinic.booking.entity.Patient;
import com.clinic.booking.entity.PatientNote;

import java.time.ZoneId;
import java.util.List;

public record PatientDetail(Long id,
                            String name,
                            String kana,
                            String phone,
                            String email,
                            String address,
                            String createdAt,
                            List<AppointmentView> appointments,
                            List<Note> notes) {

    public record Note(Long id, String note, String createdAt) {

        public static Note of(PatientNote n, ZoneId zone) {
            return new Note(n.getId(), n.getNote(), ClinicTime.format(n.getCreatedAt(), zone));
        }
    }

    public static PatientDetail of(Patient p, List<AppointmentView> appointments, List<Note> notes, ZoneId zone) {
        return new PatientDetail(p.getId(), p.getName(), p.getKana(), p.getPhone(), p.getEmail(), p.getAddress(),
                ClinicTime.format(p.getCreatedAt(), zone), appointments, notes);
    }
}

package com.clinic.booking.dto;

import com.clinic.booking.availability.ClinicTime;
import com.clinic.booking.entity.Appointment;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.ZoneId;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppointmentView(Long id,
                              String startAt,
                              String endAt,
                              String status,
                              Long serviceId,
                              String serviceName,
                              Long staffId,
                              String staffName,
                              Long patientId,
                              String patientName,
                              String patientKana,
                              String patientPhone,
                              String patientEmail,
                              String notes) {

    public static final String NO_PREFERENCE = "No preference";

    /**
     * Full view for reception staff.
     */
    public static AppointmentView of(Appointment a, ZoneId zone) {
        return new AppointmentView(
                a.getId(),
                ClinicTime.format(a.getStartAt(), zone),
                ClinicTime.format(a.getEndAt(), zone),
                a.getStatus().wireValue(),
                a.getService().getId(),
                a.getService().getName(),
                a.getStaff() == null ? null : a.getStaff().getId(),
                a.getStaff() == null ? NO_PREFERENCE : a.getStaff().getName(),
                a.getPatient().getId(),
                a.getPatient().getName(),
                a.getPatient().getKana(),
                a.getPatient().getPhone(),
                a.getPatient().getEmail(),
                a.getNotes());
    }

    /**
     * View shown to the access-token holder: no contact details or internal notes.
     */
    public static AppointmentView forPatient(Appointment a, ZoneId zone) {
        return new AppointmentView(
                a.getId(),
                ClinicTime.format(a.getStartAt(), zone),
                ClinicTime.format(a.getEndAt(), zone),
                a.getStatus().wireValue(),
                a.getService().getId(),
                a.getService().getName(),
                a.getStaff() == null ? null : a.getStaff().getId(),
                a.getStaff() == null ? NO_PREFERENCE : a.getStaff().getName(),
                null,
                a.getPatient().getName(),
                null,
                null,
                null,
                null);
    }
}

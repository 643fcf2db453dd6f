package com.clinic.booking.availability;

import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Staff;

import java.time.Instant;

/**
 * Outcome of a commit-time booking check. On success it carries the parsed
 * interval and the resolved service and staff so the caller does not reload them.
 */
public record BookingValidation(boolean valid,
                                String error,
                                ErrorKind errorKind,
                                Instant startAt,
                                Instant endAt,
                                ClinicService service,
                                Staff staff) {

    public static BookingValidation ok(Instant startAt, Instant endAt, ClinicService service, Staff staff) {
        return new BookingValidation(true, null, null, startAt, endAt, service, staff);
    }

    public static BookingValidation input(String message) {
        return failure(ErrorKind.INPUT, message);
    }

    public static BookingValidation policy(String message) {
        return failure(ErrorKind.POLICY, message);
    }

    public static BookingValidation conflict(String message) {
        return failure(ErrorKind.CONFLICT, message);
    }

    private static BookingValidation failure(ErrorKind kind, String message) {
        return new BookingValidation(false, message, kind, null, null, null, null);
    }
}

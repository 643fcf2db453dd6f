package com.clinic.booking.service;

import com.clinic.booking.availability.ErrorKind;
import com.clinic.booking.entity.Appointment;

/**
 * Result of a booking or cancellation attempt. Rejections carry a user-facing
 * message and are never thrown.
 */
public record BookingOutcome(boolean success, String message, ErrorKind errorKind,
                             Appointment appointment, String accessToken) {

    public static BookingOutcome booked(Appointment appointment, String accessToken, String message) {
        return new BookingOutcome(true, message, null, appointment, accessToken);
    }

    public static BookingOutcome done(Appointment appointment, String message) {
        return new BookingOutcome(true, message, null, appointment, null);
    }

    public static BookingOutcome rejected(ErrorKind kind, String message) {
        return new BookingOutcome(false, message, kind, null, null);
    }
}

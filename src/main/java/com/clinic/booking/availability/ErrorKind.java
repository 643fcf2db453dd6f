package com.clinic.booking.availability;

/**
 * Classes of user-facing rejections produced by the availability engine.
 */
public enum ErrorKind {
    /** Malformed date or time, missing id. */
    INPUT,
    /** Past cutoff, beyond horizon, day closed, inactive or missing service or staff. */
    POLICY,
    /** The interval is already taken up to its capacity. */
    CONFLICT
}

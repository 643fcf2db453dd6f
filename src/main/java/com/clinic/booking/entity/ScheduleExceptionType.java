package com.clinic.booking.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of date-scoped schedule overrides, declared in precedence order:
 * when several exceptions cover the same date, the one with the lowest
 * {@link #precedence()} wins.
 */
public enum ScheduleExceptionType {

    CLOSED("closed"),
    PARTIAL_CLOSED("partial_closed"),
    MODIFIED_HOURS("modified_hours"),
    SPECIAL_OPEN("special_open");

    private final String value;

    ScheduleExceptionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int precedence() {
        return ordinal();
    }

    @JsonCreator
    public static ScheduleExceptionType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Exception type is required");
        }
        for (ScheduleExceptionType type : values()) {
            if (type.value.equalsIgnoreCase(raw.trim()) || type.name().equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid exception type: " + raw);
    }
}

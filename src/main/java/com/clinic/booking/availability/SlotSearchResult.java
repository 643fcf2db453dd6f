package com.clinic.booking.availability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotSearchResult(List<Slot> slots, String error, @JsonIgnore ErrorKind errorKind) {

    public SlotSearchResult {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public static SlotSearchResult of(List<Slot> slots) {
        return new SlotSearchResult(slots, null, null);
    }

    public static SlotSearchResult failure(ErrorKind kind, String message) {
        return new SlotSearchResult(List.of(), message, kind);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}

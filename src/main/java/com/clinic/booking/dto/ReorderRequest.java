package com.clinic.booking.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Ids in display order; each row's sort order becomes its index in the list.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ReorderRequest {

    @NotNull(message = "ids is required")
    private List<Long> ids;
}

package com.clinic.booking.dto;

import java.util.List;

public record CapacityMatrixView(List<CapacityCell> capacities, int defaultCapacity) {
}

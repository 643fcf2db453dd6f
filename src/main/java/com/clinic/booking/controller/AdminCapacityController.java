package com.clinic.booking.controller;

import com.clinic.booking.dto.CapacityCell;
import com.clinic.booking.dto.CapacityMatrixView;
import com.clinic.booking.dto.CapacityValue;
import com.clinic.booking.dto.DateCapacityView;
import com.clinic.booking.service.SlotCapacityAdminService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/slot-capacities")
public class AdminCapacityController {

    private final SlotCapacityAdminService capacityAdminService;

    public AdminCapacityController(SlotCapacityAdminService capacityAdminService) {
        this.capacityAdminService = capacityAdminService;
    }

    @GetMapping
    public CapacityMatrixView matrix() {
        return capacityAdminService.matrix();
    }

    @PutMapping("/default")
    public Map<String, Object> updateDefault(@Valid @RequestBody CapacityValue body) {
        capacityAdminService.updateDefault(body.capacity());
        return Map.of("success", true);
    }

    @PutMapping("/bulk")
    public Map<String, Object> updateBulk(@RequestBody CapacityCells body) {
        int count = capacityAdminService.updateWeekly(body.capacities());
        return Map.of("success", true, "count", count);
    }

    @GetMapping("/date/{date}")
    public DateCapacityView dateView(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return capacityAdminService.dateView(date);
    }

    @PutMapping("/date/{date}")
    public Map<String, Object> updateDate(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                          @RequestBody CapacityCells body) {
        int count = capacityAdminService.updateDate(date, body.capacities());
        return Map.of("success", true, "count", count);
    }

    @PutMapping("/{dayOfWeek}/{timeSlot}")
    public Map<String, Object> updateCell(@PathVariable int dayOfWeek,
                                          @PathVariable @DateTimeFormat(pattern = "HH:mm") LocalTime timeSlot,
                                          @Valid @RequestBody CapacityValue body) {
        capacityAdminService.updateWeeklyCell(dayOfWeek, timeSlot, body.capacity());
        return Map.of("success", true);
    }

    public record CapacityCells(List<CapacityCell> capacities) {
    }
}

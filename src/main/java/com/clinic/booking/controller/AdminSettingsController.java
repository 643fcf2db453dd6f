package com.clinic.booking.controller;

import com.clinic.booking.availability.SettingsSnapshot;
import com.clinic.booking.dto.BookingSettingsRequest;
import com.clinic.booking.service.BookingSettingsService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/settings/booking")
public class AdminSettingsController {

    private final BookingSettingsService settingsService;

    public AdminSettingsController(BookingSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public SettingsSnapshot get() {
        return settingsService.snapshot();
    }

    @PutMapping
    public SettingsSnapshot update(@Valid @RequestBody BookingSettingsRequest request) {
        return settingsService.update(request);
    }
}

package com.clinic.booking.service;

import com.clinic.booking.availability.SettingsSnapshot;
import com.clinic.booking.dto.BookingSettingsRequest;
import com.clinic.booking.entity.Setting;
import com.clinic.booking.repository.SettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads and updates the booking settings stored in the {@code settings} table.
 */
@Service
public class BookingSettingsService {

    private static final Logger log = LoggerFactory.getLogger(BookingSettingsService.class);

    private final SettingRepository settingRepository;

    public BookingSettingsService(SettingRepository settingRepository) {
        this.settingRepository = settingRepository;
    }

    @Transactional(readOnly = true)
    public SettingsSnapshot snapshot() {
        Map<String, String> values = new HashMap<>();
        for (Setting setting : settingRepository.findAll()) {
            values.put(setting.getKey(), setting.getValue());
        }
        return SettingsSnapshot.fromMap(values);
    }

    @Transactional
    public SettingsSnapshot update(BookingSettingsRequest request) {
        if (request.getCutoffDays() != null) {
            put(SettingsSnapshot.KEY_CUTOFF_DAYS, request.getCutoffDays(), "Days before the appointment when booking closes");
        }
        if (request.getCutoffHours() != null) {
            put(SettingsSnapshot.KEY_CUTOFF_HOURS, request.getCutoffHours(), "Hours before midnight when booking closes");
        }
        if (request.getMaxDaysAhead() != null) {
            put(SettingsSnapshot.KEY_MAX_DAYS_AHEAD, request.getMaxDaysAhead(), "How many days ahead bookings are accepted");
        }
        if (request.getSlotDurationMinutes() != null) {
            put(SettingsSnapshot.KEY_SLOT_DURATION, request.getSlotDurationMinutes(), "Slot increment in minutes");
        }
        if (request.getDefaultSlotCapacity() != null) {
            put(SettingsSnapshot.KEY_DEFAULT_CAPACITY, request.getDefaultSlotCapacity(), "Default bookings per slot");
        }
        SettingsSnapshot updated = snapshot();
        log.info("Booking settings updated: {}", updated);
        return updated;
    }

    /**
     * Inserts a setting only when the key is absent. Used by startup seeding.
     */
    @Transactional
    public boolean putIfAbsent(String key, String value, String description) {
        if (settingRepository.existsById(key)) {
            return false;
        }
        settingRepository.save(Setting.builder().key(key).value(value).description(description).build());
        return true;
    }

    void put(String key, Object value, String description) {
        Setting setting = settingRepository.findById(key)
                .orElseGet(() -> Setting.builder().key(key).description(description).build());
        setting.setValue(String.valueOf(value));
        settingRepository.save(setting);
    }
}

package com.clinic.booking.config;

import com.clinic.booking.availability.SettingsSnapshot;
import com.clinic.booking.entity.BusinessHours;
import com.clinic.booking.entity.ClinicService;
import com.clinic.booking.entity.Staff;
import com.clinic.booking.repository.BusinessHoursRepository;
import com.clinic.booking.repository.ClinicServiceRepository;
import com.clinic.booking.repository.StaffRepository;
import com.clinic.booking.service.BookingSettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.List;

/**
 * Idempotent seeder: one business-hours row per weekday and the default booking
 * settings, plus a demo menu and staff when {@code clinic.seed-demo-data} is on.
 * Safe to re-run; existing rows are never overwritten.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private static final LocalTime OPEN = LocalTime.of(9, 0);
    private static final LocalTime WEEKDAY_CLOSE = LocalTime.of(18, 0);
    private static final LocalTime SATURDAY_CLOSE = LocalTime.of(13, 0);

    private final BusinessHoursRepository businessHoursRepository;
    private final ClinicServiceRepository serviceRepository;
    private final StaffRepository staffRepository;
    private final BookingSettingsService settingsService;
    private final boolean seedDemoData;

    public DataInitializer(BusinessHoursRepository businessHoursRepository,
                           ClinicServiceRepository serviceRepository,
                           StaffRepository staffRepository,
                           BookingSettingsService settingsService,
                           @Value("${clinic.seed-demo-data:false}") boolean seedDemoData) {
        this.businessHoursRepository = businessHoursRepository;
        this.serviceRepository = serviceRepository;
        this.staffRepository = staffRepository;
        this.settingsService = settingsService;
        this.seedDemoData = seedDemoData;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void seed() {
        int created = seedBusinessHours();
        int settings = seedSettings();
        if (seedDemoData) {
            seedCatalog();
        }
        log.info("DataInitializer: {} weekday rows and {} settings created", created, settings);
    }

    int seedBusinessHours() {
        int created = 0;
        for (int day = 0; day <= 6; day++) {
            if (businessHoursRepository.findByDayOfWeek(day).isPresent()) {
                continue;
            }
            BusinessHours.BusinessHoursBuilder row = BusinessHours.builder().dayOfWeek(day);
            if (day == 0) {
                row.closed(true);
            } else {
                row.closed(false).openTime(OPEN).closeTime(day == 6 ? SATURDAY_CLOSE : WEEKDAY_CLOSE);
            }
            businessHoursRepository.save(row.build());
            created++;
        }
        return created;
    }

    int seedSettings() {
        int created = 0;
        if (settingsService.putIfAbsent(SettingsSnapshot.KEY_CUTOFF_DAYS,
                String.valueOf(SettingsSnapshot.DEFAULT_CUTOFF_DAYS), "Days before the appointment when booking closes")) created++;
        if (settingsService.putIfAbsent(SettingsSnapshot.KEY_CUTOFF_HOURS,
                String.valueOf(SettingsSnapshot.DEFAULT_CUTOFF_HOURS), "Hours before midnight when booking closes")) created++;
        if (settingsService.putIfAbsent(SettingsSnapshot.KEY_MAX_DAYS_AHEAD,
                String.valueOf(SettingsSnapshot.DEFAULT_MAX_DAYS_AHEAD), "How many days ahead bookings are accepted")) created++;
        if (settingsService.putIfAbsent(SettingsSnapshot.KEY_SLOT_DURATION,
                String.valueOf(SettingsSnapshot.DEFAULT_SLOT_DURATION), "Slot increment in minutes")) created++;
        if (settingsService.putIfAbsent(SettingsSnapshot.KEY_DEFAULT_CAPACITY,
                String.valueOf(SettingsSnapshot.DEFAULT_CAPACITY), "Default bookings per slot")) created++;
        if (settingsService.putIfAbsent(SettingsSnapshot.KEY_LUNCH_START, "12:00", "Lunch break start")) created++;
        if (settingsService.putIfAbsent(SettingsSnapshot.KEY_LUNCH_END, "13:00", "Lunch break end")) created++;
        return created;
    }

    private void seedCatalog() {
        if (serviceRepository.count() == 0) {
            log.info("Seeding services...");
            serviceRepository.saveAll(List.of(
                    ClinicService.builder().name("First visit").description("Examination and consultation for new patients").durationMinutes(60).sortOrder(1).build(),
                    ClinicService.builder().name("Follow-up").description("Continuing treatment").durationMinutes(30).sortOrder(2).build(),
                    ClinicService.builder().name("Cleaning").description("Scaling and polishing").durationMinutes(45).sortOrder(3).build(),
                    ClinicService.builder().name("Check-up").description("Regular oral check-up").durationMinutes(30).sortOrder(4).build()
            ));
        }
        if (staffRepository.count() == 0) {
            log.info("Seeding staff...");
            staffRepository.saveAll(List.of(
                    Staff.builder().name("Taro Hiko").title("Director").sortOrder(1).build(),
                    Staff.builder().name("Hanako Yamada").title("Dentist").sortOrder(2).build(),
                    Staff.builder().name("Ichiro Suzuki").title("Dental hygienist").sortOrder(3).build()
            ));
        }
    }
}

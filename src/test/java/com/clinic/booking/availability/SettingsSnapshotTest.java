package com.clinic.booking.availability;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SettingsSnapshotTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    @Test
    void missingOrGarbageValuesFallBackToDefaults() {
        SettingsSnapshot snapshot = SettingsSnapshot.fromMap(Map.of(
                SettingsSnapshot.KEY_CUTOFF_DAYS, "abc",
                SettingsSnapshot.KEY_SLOT_DURATION, "0",
                SettingsSnapshot.KEY_DEFAULT_CAPACITY, "-2",
                SettingsSnapshot.KEY_LUNCH_START, "noon"));

        assertThat(snapshot).isEqualTo(SettingsSnapshot.defaults());
    }

    @Test
    void storedValuesAreRead() {
        SettingsSnapshot snapshot = SettingsSnapshot.fromMap(Map.of(
                SettingsSnapshot.KEY_CUTOFF_DAYS, "1",
                SettingsSnapshot.KEY_CUTOFF_HOURS, "0",
                SettingsSnapshot.KEY_MAX_DAYS_AHEAD, "14",
                SettingsSnapshot.KEY_SLOT_DURATION, "15",
                SettingsSnapshot.KEY_DEFAULT_CAPACITY, "2",
                SettingsSnapshot.KEY_LUNCH_START, "12:30",
                SettingsSnapshot.KEY_LUNCH_END, "13:30"));

        assertThat(snapshot.cutoffDays()).isEqualTo(1);
        assertThat(snapshot.cutoffHours()).isZero();
        assertThat(snapshot.maxDaysAhead()).isEqualTo(14);
        assertThat(snapshot.slotDurationMinutes()).isEqualTo(15);
        assertThat(snapshot.defaultSlotCapacity()).isEqualTo(2);
        assertThat(snapshot.lunchStart()).isEqualTo(LocalTime.of(12, 30));
        assertThat(snapshot.lunchEnd()).isEqualTo(LocalTime.of(13, 30));
    }

    @Test
    void cutoffIsTwoDaysBeforeAtNinePm() {
        Instant cutoff = SettingsSnapshot.defaults().cutoffInstant(LocalDate.of(2030, 6, 3), TOKYO);

        assertThat(cutoff).isEqualTo(Instant.parse("2030-06-01T12:00:00Z"));
    }

    @Test
    void bookingWindowIsOpenAtTheCutoffInstantAndClosedOneSecondLater() {
        SettingsSnapshot settings = SettingsSnapshot.defaults();
        LocalDate date = LocalDate.of(2030, 6, 3);
        Instant cutoff = settings.cutoffInstant(date, TOKYO);

        assertThat(settings.bookingWindowError(date, cutoff, TOKYO)).isNull();
        assertThat(settings.bookingWindowError(date, cutoff.plusSeconds(1), TOKYO))
                .isEqualTo("Booking for this date has closed (2 days before, 21:00)");
    }

    @Test
    void lastDayOfTheHorizonIsStillBookable() {
        SettingsSnapshot settings = SettingsSnapshot.defaults();
        Instant now = LocalDate.of(2030, 5, 20).atTime(8, 0).atZone(TOKYO).toInstant();

        assertThat(settings.bookingWindowError(LocalDate.of(2030, 7, 19), now, TOKYO)).isNull();
        assertThat(settings.bookingWindowError(LocalDate.of(2030, 7, 20), now, TOKYO))
                .isEqualTo("Bookings can only be made up to 60 days ahead");
    }
}

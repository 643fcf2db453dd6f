package com.clinic.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Capacity override for one time of day. Either {@code dayOfWeek} (weekly rule)
 * or {@code specificDate} (one calendar date) is set.
 */
@Entity
@Table(name = "slot_capacities", uniqueConstraints = {
    @UniqueConstraint(name = "uq_slot_capacities_day_time", columnNames = {"day_of_week", "time_slot"}),
    @UniqueConstraint(name = "uq_slot_capacities_date_time", columnNames = {"specific_date", "time_slot"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SlotCapacity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "specific_date")
    private LocalDate specificDate;

    @Column(name = "time_slot", nullable = false)
    private LocalTime timeSlot;

    @Column(nullable = false)
    @Builder.Default
    private int capacity = 1;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}

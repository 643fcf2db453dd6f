package com.clinic.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;

@Entity
@Table(name = "business_hours", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"day_of_week"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusinessHours {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Day of week: 0 = Sunday, 6 = Saturday.
     */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    /** Legacy single period, used only when neither morning nor afternoon is configured. */
    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Column(name = "morning_open")
    private LocalTime morningOpen;

    @Column(name = "morning_close")
    private LocalTime morningClose;

    @Column(name = "afternoon_open")
    private LocalTime afternoonOpen;

    @Column(name = "afternoon_close")
    private LocalTime afternoonClose;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;
}

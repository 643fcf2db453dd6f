package com.clinic.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "appointments", indexes = {
    @Index(name = "idx_appointments_start", columnList = "start_at"),
    @Index(name = "idx_appointments_status", columnList = "status"),
    @Index(name = "idx_appointments_token", columnList = "access_token_hash")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status {
        CONFIRMED, CANCELLED, COMPLETED;

        public String wireValue() {
            return name().toLowerCase();
        }

        public static Status fromValue(String raw) {
            for (Status s : values()) {
                if (s.name().equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Invalid status: " + raw);
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", nullable = false)
    private Patient patient;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "service_id", nullable = false)
    private ClinicService service;

    /** Null means "no preference"; such a booking blocks every staff member. */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "staff_id")
    private Staff staff;

    @Column(name = "start_at", nullable = false, updatable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private Instant endAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.CONFIRMED;

    @Column(name = "access_token_hash", nullable = false, length = 255)
    private String accessTokenHash;

    @Column(name = "token_expires_at", nullable = false)
    private Instant tokenExpiresAt;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

package com.karting.entries.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Driver record. The entry flows read identity and write only the season rental flag
 * and the two next-race status fields.
 */
@Entity
@Table(name = "drivers", indexes = {
    @Index(name = "idx_driver_email", columnList = "email", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverEntity {

    public static final String STATUS_REGISTERED = "Registered";
    public static final String STATUS_NOT_REGISTERED = "Not Registered";
    public static final String RENTAL_NONE = "No";
    public static final String RENTAL_BOOKED = "Yes";

    @Id
    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    @Column(name = "championship_class")
    private String championshipClass;

    @Column(name = "race_number")
    private String raceNumber;

    @ToString.Exclude
    @Column(name = "password_hash")
    private String passwordHash;

    @ToString.Exclude
    @Column(name = "reset_token_hash")
    private String resetTokenHash;

    @Column(name = "reset_token_expiry")
    private Instant resetTokenExpiry;

    @Column(name = "media_release_consent", nullable = false)
    private boolean mediaReleaseConsent;

    @Column(name = "season_engine_rental", nullable = false)
    private boolean seasonEngineRental;

    @Column(name = "next_race_entry_status", length = 50)
    private String nextRaceEntryStatus;

    @Column(name = "next_race_engine_rental_status", length = 50)
    private String nextRaceEngineRentalStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public String getFullName() {
        return (firstName + " " + lastName).trim();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (nextRaceEntryStatus == null) {
            nextRaceEntryStatus = STATUS_NOT_REGISTERED;
        }
        if (nextRaceEngineRentalStatus == null) {
            nextRaceEngineRentalStatus = RENTAL_NONE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

package com.karting.entries.api.dto;

import com.karting.entries.persistence.entity.DriverEntity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DriverDto {

    String driverId;
    String email;
    String firstName;
    String lastName;
    String championshipClass;
    String raceNumber;
    boolean mediaReleaseConsent;
    boolean seasonEngineRental;
    String nextRaceEntryStatus;
    String nextRaceEngineRentalStatus;

    public static DriverDto from(DriverEntity driver) {
        return DriverDto.builder()
                .driverId(driver.getDriverId())
                .email(driver.getEmail())
                .firstName(driver.getFirstName())
                .lastName(driver.getLastName())
                .championshipClass(driver.getChampionshipClass())
                .raceNumber(driver.getRaceNumber())
                .mediaReleaseConsent(driver.isMediaReleaseConsent())
                .seasonEngineRental(driver.isSeasonEngineRental())
                .nextRaceEntryStatus(driver.getNextRaceEntryStatus())
                .nextRaceEngineRentalStatus(driver.getNextRaceEngineRentalStatus())
                .build();
    }
}

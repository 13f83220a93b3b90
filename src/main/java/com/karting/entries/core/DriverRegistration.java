package com.karting.entries.core;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DriverRegistration {

    String email;
    String password;
    String firstName;
    String lastName;
    String championshipClass;
    String raceNumber;
    boolean mediaReleaseConsent;
}

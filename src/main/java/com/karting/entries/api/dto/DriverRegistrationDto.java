package com.karting.entries.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;

@Data
public class DriverRegistrationDto {

    @NotBlank(message = "email is required")
    @Email
    private String email;

    @ToString.Exclude
    @NotBlank(message = "password is required")
    @Size(min = 8, max = 128, message = "password must be 8 to 128 characters")
    private String password;

    @NotBlank(message = "firstName is required")
    @Size(max = 100)
    private String firstName;

    @NotBlank(message = "lastName is required")
    @Size(max = 100)
    private String lastName;

    @Size(max = 50)
    private String championshipClass;

    @Size(max = 10)
    private String raceNumber;

    private boolean mediaReleaseConsent;
}

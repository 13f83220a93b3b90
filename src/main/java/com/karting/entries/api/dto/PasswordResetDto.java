package com.karting.entries.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;

@Data
public class PasswordResetDto {

    @NotBlank(message = "email is required")
    private String email;

    @ToString.Exclude
    @NotBlank(message = "token is required")
    private String token;

    @ToString.Exclude
    @NotBlank(message = "newPassword is required")
    @Size(min = 8, max = 128, message = "newPassword must be 8 to 128 characters")
    private String newPassword;
}

package com.karting.entries.api;

import com.karting.entries.api.dto.DriverDto;
import com.karting.entries.api.dto.DriverRegistrationDto;
import com.karting.entries.api.dto.PasswordResetDto;
import com.karting.entries.api.dto.PasswordResetRequestDto;
import com.karting.entries.core.DriverAccountService;
import com.karting.entries.core.DriverRegistration;
import com.karting.entries.persistence.entity.DriverEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/drivers")
@RequiredArgsConstructor
@Tag(name = "Drivers", description = "Driver accounts, login and password reset")
public class DriverController {

    private final DriverAccountService accountService;
    private final DriverAuthenticator authenticator;

    @PostMapping("/login")
    @Operation(summary = "Check driver credentials",
            description = "HTTP Basic credentials (email:password). Returns the driver profile.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credentials valid"),
            @ApiResponse(responseCode = "401", description = "Unknown email or wrong password. Body: { \"error\": \"AUTHENTICATION_FAILED\" }"),
            @ApiResponse(responseCode = "429", description = "Too many attempts from this email or IP in the last 60s")
    })
    public ResponseEntity<DriverDto> login(HttpServletRequest httpRequest) {
        DriverEntity driver = authenticator.authenticate(httpRequest);
        return ResponseEntity.ok(DriverDto.from(driver));
    }

    @PostMapping("/register")
    @Operation(summary = "Register a driver", description = "Creates the account and sends a confirmation e-mail.")
    public ResponseEntity<DriverDto> register(@Valid @RequestBody DriverRegistrationDto dto) {
        DriverEntity driver = accountService.register(DriverRegistration.builder()
                .email(dto.getEmail())
                .password(dto.getPassword())
                .firstName(dto.getFirstName())
                .lastName(dto.getLastName())
                .championshipClass(dto.getChampionshipClass())
                .raceNumber(dto.getRaceNumber())
                .mediaReleaseConsent(dto.isMediaReleaseConsent())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(DriverDto.from(driver));
    }

    @PostMapping("/password-reset/request")
    @Operation(summary = "Request a password reset link",
            description = "Always answers 202 so the response does not reveal whether the email is registered.")
    public ResponseEntity<Map<String, String>> requestPasswordReset(@Valid @RequestBody PasswordResetRequestDto dto,
                                                                    HttpServletRequest httpRequest) {
        accountService.requestPasswordReset(dto.getEmail(), ClientRequests.clientIp(httpRequest));
        return ResponseEntity.accepted().body(Map.of("message", "If the address is registered, a reset link is on its way"));
    }

    @PostMapping("/password-reset")
    @Operation(summary = "Set a new password with a reset token")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody PasswordResetDto dto, HttpServletRequest httpRequest) {
        accountService.resetPassword(dto.getEmail(), dto.getToken(), dto.getNewPassword(), ClientRequests.clientIp(httpRequest));
        return ResponseEntity.noContent().build();
    }
}

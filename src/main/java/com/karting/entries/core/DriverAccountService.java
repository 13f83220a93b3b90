package com.karting.entries.core;

import com.karting.entries.api.AuthenticationFailedException;
import com.karting.entries.api.ValidationFailedException;
import com.karting.entries.compliance.PayerDataMasker;
import com.karting.entries.mail.EntryNotifications;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Driver accounts: registration, password login and password reset. Reset tokens are sent in
 * clear by e-mail and stored only as SHA-256 hashes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverAccountService {

    static final Duration RESET_TOKEN_VALIDITY = Duration.ofHours(1);
    private static final int MIN_PASSWORD_LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final DriverRepository driverRepository;
    private final PasswordEncoder passwordEncoder;
    private final RequestVelocityService velocityService;
    private final EntryStore entryStore;
    private final StoreTransactions transactions;
    private final EntryNotifications notifications;

    @Value("${karting.accounts.reset-url:http://localhost:8080/reset-password.html}")
    private String resetUrl;

    public DriverEntity register(DriverRegistration registration) {
        String email = normaliseEmail(registration.getEmail());
        requireText("firstName", registration.getFirstName());
        requireText("lastName", registration.getLastName());
        requirePassword(registration.getPassword());

        DriverEntity saved = transactions.execute("register_driver", () -> {
            if (driverRepository.existsByEmailIgnoreCase(email)) {
                throw new ValidationFailedException("email", "An account with this email already exists");
            }
            DriverEntity driver = DriverEntity.builder()
                    .driverId("D-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT))
                    .email(email)
                    .firstName(registration.getFirstName().trim())
                    .lastName(registration.getLastName().trim())
                    .championshipClass(registration.getChampionshipClass())
                    .raceNumber(registration.getRaceNumber())
                    .passwordHash(passwordEncoder.encode(registration.getPassword()))
                    .mediaReleaseConsent(registration.isMediaReleaseConsent())
                    .build();
            DriverEntity row = driverRepository.saveAndFlush(driver);
            entryStore.appendAudit("driver_registered", EntryCoordinator.ACTOR_DRIVER, row.getDriverId(),
                    Map.of("mediaReleaseConsent", row.isMediaReleaseConsent()));
            return row;
        });
        log.info("Driver registered: driverId={}, email={}", saved.getDriverId(), PayerDataMasker.maskEmail(email));
        notifications.registrationConfirmation(saved);
        notifications.adminActivity("Driver registered", email, saved.getFullName());
        return saved;
    }

    /**
     * Check email and password. Unknown email and wrong password fail the same way.
     *
     * @throws com.karting.entries.api.TooManyAttemptsException when the attempt is throttled
     */
    public DriverEntity authenticate(String email, String password, String clientIp) {
        velocityService.checkAttempt(email, clientIp);
        Optional<DriverEntity> driver = email == null ? Optional.empty() : driverRepository.findByEmailIgnoreCase(email.trim());
        if (driver.isEmpty() || driver.get().getPasswordHash() == null || password == null
                || !passwordEncoder.matches(password, driver.get().getPasswordHash())) {
            log.info("Login failed: email={}", PayerDataMasker.maskEmail(email));
            throw new AuthenticationFailedException("Invalid email or password");
        }
        velocityService.reset(email);
        return driver.get();
    }

    /** Issue a reset token when the email is known. Always returns normally so callers cannot probe accounts. */
    public void requestPasswordReset(String email, String clientIp) {
        velocityService.checkAttempt(email, clientIp);
        Optional<DriverEntity> found = email == null ? Optional.empty() : driverRepository.findByEmailIgnoreCase(email.trim());
        if (found.isEmpty()) {
            log.info("Password reset requested for unknown email={}", PayerDataMasker.maskEmail(email));
            return;
        }
        byte[] raw = new byte[32];
        RANDOM.nextBytes(raw);
        String token = HexFormat.of().formatHex(raw);
        DriverEntity driver = transactions.execute("request_password_reset", () -> {
            DriverEntity row = driverRepository.findById(found.get().getDriverId()).orElseThrow();
            row.setResetTokenHash(sha256(token));
            row.setResetTokenExpiry(Instant.now().plus(RESET_TOKEN_VALIDITY));
            return driverRepository.saveAndFlush(row);
        });
        String link = resetUrl + "?email=" + URLEncoder.encode(driver.getEmail(), StandardCharsets.UTF_8)
                + "&token=" + token;
        notifications.passwordReset(driver, link, (int) RESET_TOKEN_VALIDITY.toMinutes());
    }

    public void resetPassword(String email, String token, String newPassword, String clientIp) {
        velocityService.checkAttempt(email, clientIp);
        requirePassword(newPassword);
        transactions.run("reset_password", () -> {
            DriverEntity driver = email == null ? null : driverRepository.findByEmailIgnoreCase(email.trim()).orElse(null);
            if (driver == null || driver.getResetTokenHash() == null || token == null
                    || !MessageDigest.isEqual(driver.getResetTokenHash().getBytes(StandardCharsets.US_ASCII),
                            sha256(token).getBytes(StandardCharsets.US_ASCII))) {
                throw new AuthenticationFailedException("Reset link is invalid");
            }
            if (driver.getResetTokenExpiry() == null || Instant.now().isAfter(driver.getResetTokenExpiry())) {
                throw new AuthenticationFailedException("Reset link has expired");
            }
            driver.setPasswordHash(passwordEncoder.encode(newPassword));
            driver.setResetTokenHash(null);
            driver.setResetTokenExpiry(null);
            driverRepository.saveAndFlush(driver);
            entryStore.appendAudit("password_reset", EntryCoordinator.ACTOR_DRIVER, driver.getDriverId(), Map.of());
        });
        velocityService.reset(email);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String normaliseEmail(String email) {
        if (email == null || !email.trim().matches("[^@\\s]+@[^@\\s]+\\.[^@\\s]+")) {
            throw new ValidationFailedException("email", "A valid email address is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationFailedException(field, field + " is required");
        }
    }

    private static void requirePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationFailedException("password", "Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }
}

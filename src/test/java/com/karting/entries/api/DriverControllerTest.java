package com.karting.entries.api;

import com.karting.entries.core.DriverAccountService;
import com.karting.entries.core.DriverRegistration;
import com.karting.entries.persistence.entity.DriverEntity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = DriverController.class)
@Import(DriverAuthenticator.class)
class DriverControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DriverAccountService accountService;

    @Test
    void registerCreatesDriver() throws Exception {
        when(accountService.register(any())).thenReturn(DriverEntity.builder()
                .driverId("D-010")
                .email("dee@example.test")
                .firstName("Dee")
                .lastName("River")
                .championshipClass("Senior Rotax")
                .passwordHash("$2a$10$hash")
                .build());

        mockMvc.perform(post("/api/v1/drivers/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "dee@example.test",
                                  "password": "s3cret-pass",
                                  "firstName": "Dee",
                                  "lastName": "River",
                                  "championshipClass": "Senior Rotax",
                                  "mediaReleaseConsent": true
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.driverId").value("D-010"))
                .andExpect(jsonPath("$.passwordHash").doesNotExist());

        ArgumentCaptor<DriverRegistration> registration = ArgumentCaptor.forClass(DriverRegistration.class);
        verify(accountService).register(registration.capture());
        assertThat(registration.getValue().isMediaReleaseConsent()).isTrue();
    }

    @Test
    void shortPasswordIsRejectedBeforeTheService() throws Exception {
        mockMvc.perform(post("/api/v1/drivers/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"dee@example.test\",\"password\":\"short\",\"firstName\":\"Dee\",\"lastName\":\"River\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("password"));
        verifyNoInteractions(accountService);
    }

    @Test
    void resetRequestAlwaysAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/drivers/password-reset/request")
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"nobody@example.test\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.message").exists());
        verify(accountService).requestPasswordReset("nobody@example.test", "203.0.113.9");
    }

    @Test
    void resetWithTokenAnswersNoContent() throws Exception {
        mockMvc.perform(post("/api/v1/drivers/password-reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"dee@example.test\",\"token\":\"abc123\",\"newPassword\":\"n3w-s3cret\"}"))
                .andExpect(status().isNoContent());
        verify(accountService).resetPassword(eq("dee@example.test"), eq("abc123"), eq("n3w-s3cret"), anyString());
    }

    @Test
    void expiredResetTokenIsValidationFailure() throws Exception {
        doThrow(new ValidationFailedException("token", "Reset link is invalid or has expired"))
                .when(accountService).resetPassword(anyString(), anyString(), anyString(), anyString());

        mockMvc.perform(post("/api/v1/drivers/password-reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"dee@example.test\",\"token\":\"stale\",\"newPassword\":\"n3w-s3cret\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.field").value("token"));
    }

    @Test
    void throttledLoginIsTooManyAttempts() throws Exception {
        when(accountService.authenticate(anyString(), anyString(), anyString()))
                .thenThrow(new TooManyAttemptsException("Too many login attempts, try again in a minute"));

        mockMvc.perform(post("/api/v1/drivers/login")
                        .header(HttpHeaders.AUTHORIZATION, "Basic " + Base64.getEncoder()
                                .encodeToString("dee@example.test:s3cret-pass".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("TOO_MANY_ATTEMPTS"));
    }

    @Test
    void malformedBasicHeaderIsAuthenticationFailure() throws Exception {
        mockMvc.perform(post("/api/v1/drivers/login").header(HttpHeaders.AUTHORIZATION, "Basic !!!not-base64"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Malformed credentials"));
        verifyNoInteractions(accountService);
    }
}

package com.karting.entries.api;

import com.karting.entries.core.DriverAccountService;
import com.karting.entries.persistence.entity.DriverEntity;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Resolves the calling driver from HTTP Basic credentials. Every driver request re-checks the
 * password against the stored hash; there is no session.
 */
@Component
@RequiredArgsConstructor
public class DriverAuthenticator {

    private static final String BASIC_PREFIX = "Basic ";

    private final DriverAccountService accountService;

    public DriverEntity authenticate(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            throw new AuthenticationFailedException("Driver credentials required");
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationFailedException("Malformed credentials");
        }
        int colon = decoded.indexOf(':');
        if (colon <= 0) {
            throw new AuthenticationFailedException("Malformed credentials");
        }
        return accountService.authenticate(decoded.substring(0, colon), decoded.substring(colon + 1),
                ClientRequests.clientIp(request));
    }
}

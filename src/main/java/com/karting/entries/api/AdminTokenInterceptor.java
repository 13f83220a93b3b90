package com.karting.entries.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards {@code /api/v1/admin/**} with the shared {@code X-Admin-Token}. With no token configured
 * every admin call is refused.
 */
@Slf4j
@Component
public class AdminTokenInterceptor implements HandlerInterceptor {

    public static final String TOKEN_HEADER = "X-Admin-Token";
    public static final String ACTOR_HEADER = "X-Admin-Actor";

    private final byte[] expectedToken;

    public AdminTokenInterceptor(@Value("${karting.admin.token:}") String adminToken) {
        this.expectedToken = adminToken == null ? new byte[0] : adminToken.getBytes(StandardCharsets.UTF_8);
        if (expectedToken.length == 0) {
            log.warn("karting.admin.token is not set; admin endpoints will reject every request");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String supplied = request.getHeader(TOKEN_HEADER);
        if (expectedToken.length == 0 || supplied == null
                || !MessageDigest.isEqual(expectedToken, supplied.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Admin request rejected: method={}, path={}, ip={}", request.getMethod(),
                    request.getRequestURI(), ClientRequests.clientIp(request));
            throw new AuthenticationFailedException("Admin token missing or invalid");
        }
        return true;
    }
}

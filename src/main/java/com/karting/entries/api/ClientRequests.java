package com.karting.entries.api;

import jakarta.servlet.http.HttpServletRequest;

final class ClientRequests {

    static final String ADMIN_PATH_PREFIX = "/api/v1/admin";

    private ClientRequests() {
    }

    static String clientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        String xri = request.getHeader("X-Real-IP");
        if (xri != null && !xri.isBlank()) return xri.trim();
        return request.getRemoteAddr();
    }

    static boolean isAdminPath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String context = request.getContextPath();
        String path = context != null && !context.isEmpty() && uri.startsWith(context) ? uri.substring(context.length()) : uri;
        return path.startsWith(ADMIN_PATH_PREFIX);
    }
}

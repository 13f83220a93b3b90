package com.karting.entries.domain;

import java.util.Locale;

/**
 * Payment status as reported by the gateway on a notification.
 */
public enum GatewayPaymentStatus {
    COMPLETE,
    PENDING,
    FAILED,
    CANCELLED,
    UNRECOGNISED;

    public static GatewayPaymentStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNRECOGNISED;
        }
        switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "COMPLETE":
            case "COMPLETED":
                return COMPLETE;
            case "PENDING":
                return PENDING;
            case "FAILED":
                return FAILED;
            case "CANCELLED":
            case "CANCELED":
                return CANCELLED;
            default:
                return UNRECOGNISED;
        }
    }
}

package com.karting.entries.compliance;

/**
 * Redacts payer identity so it is safe to include in logs.
 * Use these masks whenever an e-mail address or payer name would reach a log line.
 */
public final class PayerDataMasker {

    private static final String MASKED_NAME = "***";

    private PayerDataMasker() {}

    /** {@code "jane.doe@example.com"} becomes {@code "j***@example.com"}. */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return null;
        int at = email.indexOf('@');
        if (at <= 0) return MASKED_NAME;
        return email.charAt(0) + MASKED_NAME + email.substring(at);
    }

    /** Keeps the initial only. */
    public static String maskName(String name) {
        if (name == null || name.isBlank()) return null;
        return name.trim().charAt(0) + MASKED_NAME;
    }
}

package com.karting.entries.mail;

/**
 * The mail provider refused or could not be reached. Logged by the mail queue and never
 * propagated to business callers.
 */
public class MailDeliveryException extends RuntimeException {

    public MailDeliveryException(String message) {
        super(message);
    }

    public MailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

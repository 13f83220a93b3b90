package com.karting.entries.mail;

/**
 * Hands a rendered message to an external transactional e-mail provider.
 */
public interface MailTransport {

    /**
     * @throws MailDeliveryException when the provider does not accept the message
     */
    void send(EmailMessage message);
}

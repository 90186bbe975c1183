package com.encdiary.server.mail;

/**
 * Outbound mail transport.
 */
public interface Mailer {

    /**
     * False when no usable credentials are configured; callers skip sending.
     */
    boolean isConfigured();

    void send(String recipient, String subject, String body) throws MailDeliveryException;
}

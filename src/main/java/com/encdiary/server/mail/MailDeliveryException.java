package com.encdiary.server.mail;

/**
 * The outbound transport refused or failed to deliver a message.
 */
public class MailDeliveryException extends Exception {

    public MailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

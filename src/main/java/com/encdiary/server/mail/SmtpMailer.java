package com.encdiary.server.mail;

import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.config.MailSettings;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

/**
 * Sends plain text mail through the SMTP server named in {@link MailSettings}.
 */
public class SmtpMailer implements Mailer {

    private static final Logger log = LoggerFactory.getLogger(SmtpMailer.class);

    private final MailSettings settings;
    private final Session session;

    public SmtpMailer(MailSettings settings) {
        this.settings = settings;
        this.session = Session.getInstance(sessionProperties(settings), authenticator(settings));
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public void send(String recipient, String subject, String body) throws MailDeliveryException {
        try {
            Transport.send(buildMessage(recipient, subject, body));
            log.info("Sent '{}' via {}:{}", subject, settings.getHost(), settings.getPort());
        } catch (MessagingException e) {
            throw new MailDeliveryException("Could not send mail via " + settings.getHost(), e);
        }
    }

    MimeMessage buildMessage(String recipient, String subject, String body) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(settings.getDefaultSender()));
        message.setRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
        message.setSubject(subject, "UTF-8");
        message.setText(body, "UTF-8");
        return message;
    }

    static Properties sessionProperties(MailSettings settings) {
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", settings.getHost());
        props.put("mail.smtp.port", String.valueOf(settings.getPort()));
        props.put("mail.smtp.auth", String.valueOf(settings.getPassword() != null));
        props.put("mail.smtp.starttls.enable", String.valueOf(settings.isStartTls()));
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "10000");
        return props;
    }

    private static Authenticator authenticator(MailSettings settings) {
        if (settings.getPassword() == null) {
            return null;
        }
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(settings.getUsername(), settings.getPassword());
            }
        };
    }
}

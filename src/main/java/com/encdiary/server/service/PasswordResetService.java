package com.encdiary.server.service;

import java.util.Optional;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.encdiary.server.mail.MailDeliveryException;
import com.encdiary.server.mail.Mailer;
import com.encdiary.server.model.UserAccount;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Mails a password reset link to an account holder. Delivery is best effort:
 * a mail failure is reported in the outcome, never thrown.
 */
@ApplicationScoped
public class PasswordResetService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    static final String SUBJECT = "Personal Diary - Password Reset Request";

    private final UserService users;
    private final Mailer mailer;

    // CDI proxy
    PasswordResetService() {
        this(null, null);
    }

    @Inject
    public PasswordResetService(UserService users, Mailer mailer) {
        this.users = users;
        this.mailer = mailer;
    }

    /**
     * @param email address typed by the requester, matched exactly
     * @param resetLink turns a token into the absolute reset URL
     */
    public ResetRequestOutcome requestReset(String email, UnaryOperator<String> resetLink) {
        // checked before the lookup so the outcome is the same for every address
        if (!mailer.isConfigured()) {
            log.warn("Reset email skipped: MAIL_USERNAME is empty or still the placeholder");
            return ResetRequestOutcome.MAIL_NOT_CONFIGURED;
        }
        if (email == null || email.isBlank()) {
            return ResetRequestOutcome.NO_ACCOUNT;
        }
        Optional<UserAccount> user = users.findByEmail(email);
        if (user.isEmpty()) {
            return ResetRequestOutcome.NO_ACCOUNT;
        }

        String token = users.issueResetToken(user.get());
        try {
            mailer.send(user.get().getEmail(), SUBJECT, body(resetLink.apply(token)));
            return ResetRequestOutcome.SENT;
        } catch (MailDeliveryException e) {
            log.error("Could not send reset email for user id={}. Check MAIL_ settings.", user.get().getId(), e);
            return ResetRequestOutcome.MAIL_FAILED;
        }
    }

    static String body(String resetUrl) {
        return """
                To reset your password, visit the following link:
                %s

                If you did not make this request then simply ignore this email and no changes will be made.
                The link will expire in 30 minutes.
                """.formatted(resetUrl);
    }
}

package com.encdiary.server.service;

/**
 * What happened to a password reset request. Only the mail failures are
 * surfaced to the user, as a warning; the account lookup result is not.
 */
public enum ResetRequestOutcome {
    NO_ACCOUNT,
    SENT,
    MAIL_NOT_CONFIGURED,
    MAIL_FAILED
}

package com.encdiary.server.error;

public class DuplicateEmailException extends DiaryException {

    public DuplicateEmailException(String email) {
        super("Email '" + email + "' is already registered.");
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super("Email '" + email + "' is already registered.", cause);
    }
}

package com.encdiary.server.error;

/**
 * A required field is missing, empty or out of bounds.
 */
public class ValidationException extends DiaryException {

    public ValidationException(String message) {
        super(message);
    }
}

package com.encdiary.server.error;

/**
 * Base type for failures the diary reports to its callers.
 */
public class DiaryException extends RuntimeException {

    public DiaryException(String message) {
        super(message);
    }

    public DiaryException(String message, Throwable cause) {
        super(message, cause);
    }
}

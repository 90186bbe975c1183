package com.encdiary.server.error;

/**
 * Persistence failed and the transaction was rolled back. The message is safe
 * to show; the cause is for the log only.
 */
public class StoreException extends DiaryException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

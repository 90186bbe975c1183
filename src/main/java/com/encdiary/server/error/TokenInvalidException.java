package com.encdiary.server.error;

/**
 * A signed token was malformed, forged, issued for another purpose or expired.
 * Callers never distinguish between these cases.
 */
public class TokenInvalidException extends DiaryException {

    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}

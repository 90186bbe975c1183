package com.encdiary.server.error;

/**
 * The caller tried to modify an entry owned by another user.
 */
public class EntryAccessDeniedException extends DiaryException {

    public EntryAccessDeniedException(long entryId, long callerId) {
        super("User " + callerId + " does not own entry " + entryId);
    }
}

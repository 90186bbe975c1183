package com.encdiary.server.error;

public class EntryNotFoundException extends DiaryException {

    public EntryNotFoundException(long entryId) {
        super("No entry found for id " + entryId);
    }
}

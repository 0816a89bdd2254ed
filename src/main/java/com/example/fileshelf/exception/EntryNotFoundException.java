package com.example.fileshelf.exception;

public class EntryNotFoundException extends FileShelfException {

    public EntryNotFoundException(String entryId) {
        super("Entry not found: " + entryId);
    }
}

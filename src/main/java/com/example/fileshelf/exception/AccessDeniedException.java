package com.example.fileshelf.exception;

public class AccessDeniedException extends FileShelfException {

    public AccessDeniedException(String entryId, String userId, String operation) {
        super("User " + userId + " may not " + operation + " entry " + entryId);
    }
}

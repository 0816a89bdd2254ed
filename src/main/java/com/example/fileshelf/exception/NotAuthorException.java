package com.example.fileshelf.exception;

/**
 * Raised when someone other than the author tries to change who may access an entry.
 */
public class NotAuthorException extends FileShelfException {

    public NotAuthorException(String entryId, String actorId) {
        super("User " + actorId + " is not the author of entry " + entryId);
    }
}

package com.example.fileshelf.exception;

/**
 * Raised when re-parenting would place an entry under itself or one of its descendants.
 */
public class InvalidParentException extends FileShelfException {

    public InvalidParentException(String entryId, String parentId) {
        super("Entry " + entryId + " cannot be moved under " + parentId);
    }
}

package com.example.fileshelf.exception;

/**
 * Infrastructure failure talking to the object store. Not a
 * {@link FileShelfException}, so callers see it as an opaque infrastructure error.
 */
public class ObjectStorageException extends RuntimeException {

    public ObjectStorageException(String message) {
        super(message);
    }

    public ObjectStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

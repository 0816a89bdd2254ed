package com.example.fileshelf.exception;

/**
 * Base of the domain errors raised by the metadata core. Callers map these to
 * responses; the core itself never recovers from them.
 */
public abstract class FileShelfException extends RuntimeException {

    protected FileShelfException(String message) {
        super(message);
    }
}

package com.example.fileshelf.exception;

import java.time.Duration;

public class InvalidSessionTtlException extends FileShelfException {

    public InvalidSessionTtlException(Duration requested) {
        super("Session lifetime must be positive, got " + requested);
    }
}

package com.example.fileshelf.exception;

import java.time.Duration;

public class SessionTooLongException extends FileShelfException {

    public SessionTooLongException(Duration requested, Duration max) {
        super("Session lifetime " + requested + " exceeds the maximum of " + max);
    }
}

package com.example.fileshelf.exception;

public class SessionNotFoundException extends FileShelfException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}

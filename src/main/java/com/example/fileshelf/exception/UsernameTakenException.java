package com.example.fileshelf.exception;

public class UsernameTakenException extends FileShelfException {

    public UsernameTakenException(String username) {
        super("Username already taken: " + username);
    }
}

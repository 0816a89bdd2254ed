package com.example.fileshelf.exception;

public class UserNotFoundException extends FileShelfException {

    public UserNotFoundException(String user) {
        super("User not found: " + user);
    }
}

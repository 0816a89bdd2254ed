package com.example.fileshelf.exception;

public class ObjectNotFoundException extends ObjectStorageException {

    public ObjectNotFoundException(String objectName, Throwable cause) {
        super("Object not found in bucket: " + objectName, cause);
    }
}

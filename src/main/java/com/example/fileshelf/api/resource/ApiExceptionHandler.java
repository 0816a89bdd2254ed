package com.example.fileshelf.api.resource;

import com.example.fileshelf.dto.MessageResponse;
import com.example.fileshelf.exception.AccessDeniedException;
import com.example.fileshelf.exception.EntryNotFoundException;
import com.example.fileshelf.exception.InvalidParentException;
import com.example.fileshelf.exception.InvalidSessionTtlException;
import com.example.fileshelf.exception.NotAuthorException;
import com.example.fileshelf.exception.ObjectNotFoundException;
import com.example.fileshelf.exception.ObjectStorageException;
import com.example.fileshelf.exception.SessionNotFoundException;
import com.example.fileshelf.exception.SessionTooLongException;
import com.example.fileshelf.exception.UserNotFoundException;
import com.example.fileshelf.exception.UsernameTakenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the core's exceptions to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({EntryNotFoundException.class, UserNotFoundException.class})
    public ResponseEntity<MessageResponse> handleNotFound(RuntimeException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<MessageResponse> handleSessionNotFound(SessionNotFoundException e) {
        return respond(HttpStatus.UNAUTHORIZED, e);
    }

    @ExceptionHandler({SessionTooLongException.class, InvalidSessionTtlException.class, InvalidParentException.class})
    public ResponseEntity<MessageResponse> handleBadRequest(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({NotAuthorException.class, AccessDeniedException.class})
    public ResponseEntity<MessageResponse> handleForbidden(RuntimeException e) {
        return respond(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler({UsernameTakenException.class, ObjectNotFoundException.class})
    public ResponseEntity<MessageResponse> handleConflict(RuntimeException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ObjectStorageException.class)
    public ResponseEntity<MessageResponse> handleStorage(ObjectStorageException e) {
        log.error("Object storage failure", e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new MessageResponse("object storage unavailable"));
    }

    private static ResponseEntity<MessageResponse> respond(HttpStatus status, RuntimeException e) {
        log.warn("{}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new MessageResponse(e.getMessage()));
    }
}

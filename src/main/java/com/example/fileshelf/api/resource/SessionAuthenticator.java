package com.example.fileshelf.api.resource;

import com.example.fileshelf.exception.SessionNotFoundException;
import com.example.fileshelf.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the session cookie of a request to a user id.
 */
@Component
@RequiredArgsConstructor
public class SessionAuthenticator {

    public static final String COOKIE = "session_id";

    private final SessionService sessionService;

    public String currentUserId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new SessionNotFoundException("<none>");
        }
        return sessionService.requireActiveSession(sessionId).userId();
    }
}

package com.example.fileshelf.api.resource;

import com.example.fileshelf.config.FileShelfProperties;
import com.example.fileshelf.dto.LoginRequest;
import com.example.fileshelf.dto.MessageResponse;
import com.example.fileshelf.dto.RegisterRequest;
import com.example.fileshelf.dto.SessionDto;
import com.example.fileshelf.dto.UserDto;
import com.example.fileshelf.dto.UserUpdate;
import com.example.fileshelf.service.SessionService;
import com.example.fileshelf.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Optional;

/**
 * REST controller for accounts and login sessions. The session id travels in a cookie.
 */
@Slf4j
@RestController
@RequestMapping("/user")
@RequiredArgsConstructor
public class UserResource {

    private final UserService userService;
    private final SessionService sessionService;
    private final SessionAuthenticator authenticator;
    private final FileShelfProperties properties;

    @GetMapping
    public UserDto getMe(@CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId) {
        return userService.getUser(authenticator.currentUserId(sessionId));
    }

    @PostMapping
    public UserDto register(@Valid @RequestBody RegisterRequest request) {
        return userService.register(request.username(), request.displayName(), request.password());
    }

    /**
     * Checks the credentials and hands out a session cookie.
     *
     * @param expireTime Requested session lifetime as an ISO-8601 duration, e.g. {@code P7D}.
     */
    @PostMapping("/login")
    public ResponseEntity<MessageResponse> login(
            @Valid @RequestBody LoginRequest request,
            @RequestParam(required = false) Duration expireTime
    ) {
        Optional<UserDto> user = userService.login(request.username(), request.password());
        if (user.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new MessageResponse("wrong password"));
        }
        Duration ttl = expireTime == null ? properties.getSession().getDefaultTtl() : expireTime;
        SessionDto session = sessionService.createSession(user.get().id(), ttl);
        ResponseCookie cookie = ResponseCookie.from(SessionAuthenticator.COOKIE, session.id())
                .httpOnly(true)
                .path("/")
                .maxAge(ttl)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(MessageResponse.ok());
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId
    ) {
        authenticator.currentUserId(sessionId);
        sessionService.deleteSession(sessionId);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, expiredCookie().toString())
                .body(MessageResponse.ok());
    }

    @PutMapping
    public UserDto updateMe(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestBody UserUpdate update
    ) {
        return userService.updateUser(authenticator.currentUserId(sessionId), update);
    }

    @DeleteMapping
    public ResponseEntity<MessageResponse> deleteMe(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId
    ) {
        userService.deleteUser(authenticator.currentUserId(sessionId));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, expiredCookie().toString())
                .body(MessageResponse.ok());
    }

    private static ResponseCookie expiredCookie() {
        return ResponseCookie.from(SessionAuthenticator.COOKIE, "").path("/").maxAge(0).build();
    }
}

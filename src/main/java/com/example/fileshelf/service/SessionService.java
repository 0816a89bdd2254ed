package com.example.fileshelf.service;

import com.example.fileshelf.cache.CacheKey;
import com.example.fileshelf.cache.MetadataCache;
import com.example.fileshelf.config.FileShelfProperties;
import com.example.fileshelf.dto.SessionDto;
import com.example.fileshelf.entity.UserSession;
import com.example.fileshelf.exception.InvalidSessionTtlException;
import com.example.fileshelf.exception.SessionNotFoundException;
import com.example.fileshelf.exception.SessionTooLongException;
import com.example.fileshelf.exception.UserNotFoundException;
import com.example.fileshelf.repository.UserRepository;
import com.example.fileshelf.repository.UserSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Login sessions. {@link #getSession} returns a session whatever its validity;
 * {@link #requireActiveSession} is the lookup that also enforces {@code validUntil}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private final UserSessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final MetadataCache cache;
    private final FileShelfProperties properties;
    private final Clock clock;

    @Transactional
    public SessionDto createSession(String userId, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            log.warn("Rejected session of {} for user {}", ttl, userId);
            throw new InvalidSessionTtlException(ttl);
        }
        Duration max = properties.getSession().getMaxTtl();
        if (ttl.compareTo(max) > 0) {
            log.warn("Rejected session of {} for user {}, limit is {}", ttl, userId, max);
            throw new SessionTooLongException(ttl, max);
        }
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }

        UserSession session = UserSession.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .validUntil(Instant.now(clock).plus(ttl))
                .build();
        SessionDto dto = SessionDto.from(sessionRepository.saveAndFlush(session));
        log.info("Created session for user {} valid until {}", userId, dto.validUntil());

        cache.afterCommit(() -> cache.write(CacheKey.session(dto.id()), dto));
        return dto;
    }

    @Transactional(readOnly = true)
    public SessionDto getSession(String id) {
        return cache.read(CacheKey.session(id), () -> sessionRepository.findById(id)
                .map(SessionDto::from)
                .orElseThrow(() -> new SessionNotFoundException(id)));
    }

    @Transactional
    public void deleteSession(String id) {
        if (!sessionRepository.existsById(id)) {
            throw new SessionNotFoundException(id);
        }
        sessionRepository.deleteById(id);
        cache.afterCommit(() -> cache.invalidate(CacheKey.session(id)));
    }

    public boolean isExpired(SessionDto session) {
        return session.isExpiredAt(Instant.now(clock));
    }

    /**
     * Like {@link #getSession} but treats an expired session as gone, deleting it.
     */
    @Transactional(noRollbackFor = SessionNotFoundException.class)
    public SessionDto requireActiveSession(String id) {
        SessionDto session = getSession(id);
        if (isExpired(session)) {
            log.info("Session {} of user {} expired at {}", id, session.userId(), session.validUntil());
            deleteSession(id);
            throw new SessionNotFoundException(id);
        }
        return session;
    }
}

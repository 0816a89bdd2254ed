package com.example.fileshelf.service;

import com.example.fileshelf.cache.CacheKey;
import com.example.fileshelf.cache.CacheKind;
import com.example.fileshelf.cache.MetadataCache;
import com.example.fileshelf.dto.UserDto;
import com.example.fileshelf.dto.UserUpdate;
import com.example.fileshelf.entity.Entry;
import com.example.fileshelf.entity.User;
import com.example.fileshelf.exception.UserNotFoundException;
import com.example.fileshelf.exception.UsernameTakenException;
import com.example.fileshelf.repository.EntryRepository;
import com.example.fileshelf.repository.TransactionRepository;
import com.example.fileshelf.repository.UserRepository;
import com.example.fileshelf.repository.UserSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final UserSessionRepository sessionRepository;
    private final EntryRepository entryRepository;
    private final TransactionRepository transactionRepository;
    private final CredentialHasher credentialHasher;
    private final MetadataCache cache;

    @Transactional
    public UserDto register(String username, String displayName, String password) {
        if (userRepository.existsByUsername(username)) {
            throw new UsernameTakenException(username);
        }
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .username(username)
                .displayName(displayName)
                .password(credentialHasher.hash(password))
                .build();
        UserDto dto = UserDto.from(userRepository.saveAndFlush(user));
        log.info("Registered user {} ({})", username, dto.id());
        return dto;
    }

    /**
     * @return the user if the password matches, empty otherwise
     * @throws UserNotFoundException if nobody has this username
     */
    @Transactional(readOnly = true)
    public Optional<UserDto> login(String username, String password) {
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new UserNotFoundException(username));
        if (!credentialHasher.verify(user.getPassword(), password)) {
            log.warn("Wrong password for user {}", username);
            return Optional.empty();
        }
        return Optional.of(UserDto.from(user));
    }

    @Transactional(readOnly = true)
    public UserDto getUser(String id) {
        return cache.read(CacheKey.user(id), () -> userRepository.findById(id)
                .map(UserDto::from)
                .orElseThrow(() -> new UserNotFoundException(id)));
    }

    @Transactional(readOnly = true)
    public List<UserDto> listUsers() {
        return userRepository.findAll().stream().map(UserDto::from).toList();
    }

    @Transactional
    public UserDto updateUser(String id, UserUpdate update) {
        User user = userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));
        if (update.username() != null && !update.username().equals(user.getUsername())) {
            if (userRepository.existsByUsername(update.username())) {
                throw new UsernameTakenException(update.username());
            }
            user.setUsername(update.username());
        }
        if (update.displayName() != null) {
            user.setDisplayName(update.displayName());
        }
        if (update.password() != null) {
            user.setPassword(credentialHasher.hash(update.password()));
        }
        UserDto dto = UserDto.from(userRepository.saveAndFlush(user));
        cache.afterCommit(() -> cache.write(CacheKey.user(id), dto));
        return dto;
    }

    /**
     * Deletes the user with everything hanging off it: sessions, authored entries with
     * their transactions, and transactions the user performed on other entries.
     */
    @Transactional
    public void deleteUser(String id) {
        User user = userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));

        List<String> sessionIds = sessionRepository.findIdsByUserId(id);
        sessionRepository.deleteByUserId(id);

        List<Entry> entries = entryRepository.findByAuthorId(id);
        List<String> entryIds = entries.stream().map(Entry::getId).toList();
        if (!entryIds.isEmpty()) {
            transactionRepository.deleteByEntryIds(entryIds);
        }
        transactionRepository.deleteByActorId(id);
        entryRepository.deleteAll(entries);
        userRepository.delete(user);
        log.info("Deleted user {} with {} entries and {} sessions", id, entryIds.size(), sessionIds.size());

        cache.afterCommit(() -> {
            cache.invalidate(CacheKey.user(id));
            sessionIds.forEach(sessionId -> cache.invalidate(CacheKey.session(sessionId)));
            entryIds.forEach(entryId -> cache.invalidate(CacheKey.entry(entryId)));
            cache.invalidateAll(CacheKind.ENTRIES, id);
        });
    }
}

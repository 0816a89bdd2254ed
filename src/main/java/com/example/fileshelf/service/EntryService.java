package com.example.fileshelf.service;

import com.example.fileshelf.cache.CacheKey;
import com.example.fileshelf.cache.CacheKind;
import com.example.fileshelf.cache.MetadataCache;
import com.example.fileshelf.dto.EntryDto;
import com.example.fileshelf.dto.EntryUpdate;
import com.example.fileshelf.dto.TransactionDto;
import com.example.fileshelf.entity.Entry;
import com.example.fileshelf.entity.EntryStatus;
import com.example.fileshelf.entity.EntryType;
import com.example.fileshelf.entity.TransactionAction;
import com.example.fileshelf.exception.EntryNotFoundException;
import com.example.fileshelf.exception.InvalidParentException;
import com.example.fileshelf.exception.NotAuthorException;
import com.example.fileshelf.exception.UserNotFoundException;
import com.example.fileshelf.repository.EntryRepository;
import com.example.fileshelf.repository.TransactionRepository;
import com.example.fileshelf.repository.UserRepository;
import com.example.fileshelf.storage.ObjectStat;
import com.example.fileshelf.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Lifecycle of entries in the tree: creation, finalization after upload, metadata
 * updates, cascading soft delete/restore and hard delete.
 * <p>
 * Every mutation commits the row change and its audit record in one transaction, then
 * refreshes the cache once that transaction has committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryService {

    private final EntryRepository entryRepository;
    private final TransactionRepository transactionRepository;
    private final UserRepository userRepository;
    private final TransactionLog transactionLog;
    private final ObjectStorage objectStorage;
    private final MetadataCache cache;
    private final Clock clock;

    @Transactional(readOnly = true)
    public EntryDto getEntry(String id) {
        return cache.read(CacheKey.entry(id), () -> EntryDto.from(load(id)));
    }

    /**
     * Finalized entries of {@code ownerId}, optionally including soft-deleted ones and
     * optionally narrowed to the children of {@code parentId}.
     *
     * @throws EntryNotFoundException if {@code parentId} is given and does not exist
     */
    @Transactional(readOnly = true)
    public List<EntryDto> listEntries(String ownerId, boolean includeDeleted, String parentId) {
        return cache.read(CacheKey.entries(ownerId, includeDeleted, parentId), () -> {
            List<Entry> rows;
            if (parentId == null) {
                rows = includeDeleted
                        ? entryRepository.findByAuthorIdAndStatus(ownerId, EntryStatus.FINALIZED)
                        : entryRepository.findByAuthorIdAndStatusAndDeletedFalse(ownerId, EntryStatus.FINALIZED);
            } else {
                if (!Entry.ROOT.equals(parentId)) {
                    getEntry(parentId);
                }
                rows = includeDeleted
                        ? entryRepository.findByAuthorIdAndStatusAndParentId(ownerId, EntryStatus.FINALIZED, parentId)
                        : entryRepository.findByAuthorIdAndStatusAndParentIdAndDeletedFalse(ownerId, EntryStatus.FINALIZED, parentId);
            }
            return rows.stream().map(EntryDto::from).toList();
        });
    }

    @Transactional
    public EntryDto addEntry(String name, EntryType type, String authorId, String parentId) {
        if (!userRepository.existsById(authorId)) {
            throw new UserNotFoundException(authorId);
        }
        String parent = parentId == null ? Entry.ROOT : parentId;
        if (!Entry.ROOT.equals(parent)) {
            load(parent);
        }

        Entry entry = Entry.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .type(type)
                .status(type == EntryType.DIRECTORY ? EntryStatus.FINALIZED : EntryStatus.PENDING)
                .authorId(authorId)
                .parentId(parent)
                .build();
        Entry saved = entryRepository.saveAndFlush(entry);
        transactionLog.append(saved.getId(), authorId, TransactionAction.ADD);

        EntryDto dto = EntryDto.from(saved);
        refreshAfterCommit(dto);
        return dto;
    }

    /**
     * Marks the upload of {@code id} as complete, taking the size from the stored object.
     *
     * @throws com.example.fileshelf.exception.ObjectNotFoundException if nothing was uploaded
     */
    @Transactional
    public EntryDto finalizeEntry(String id, String actorId) {
        Entry entry = load(id);
        ObjectStat stat = objectStorage.statObject(id);
        entry.setSize(stat.size());
        entry.setStatus(EntryStatus.FINALIZED);
        Entry saved = entryRepository.saveAndFlush(entry);
        transactionLog.append(id, actorId, TransactionAction.FINALIZE);

        EntryDto dto = EntryDto.from(saved);
        refreshAfterCommit(dto);
        return dto;
    }

    @Transactional
    public EntryDto finalizeEntry(String id) {
        return finalizeEntry(id, load(id).getAuthorId());
    }

    /**
     * Applies the non-null fields of {@code update}. Only the author may change the
     * permission mode; anyone allowed to modify the entry may edit its member set. A new
     * parent must exist and must not be the entry or one of its descendants.
     */
    @Transactional
    public EntryDto updateEntry(String id, EntryUpdate update, String actorId) {
        Entry entry = load(id);

        if (changesPermission(entry, update) && !entry.getAuthorId().equals(actorId)) {
            log.warn("User {} tried to change permission of entry {} owned by {}", actorId, id, entry.getAuthorId());
            throw new NotAuthorException(id, actorId);
        }
        if (update.parentId() != null && !update.parentId().equals(entry.getParentId())) {
            checkParent(id, update.parentId());
            entry.setParentId(update.parentId());
        }
        if (update.name() != null) {
            entry.setName(update.name());
        }
        if (update.permission() != null) {
            entry.setPermission(update.permission());
        }
        if (update.permissionInclusive() != null) {
            entry.getPermissionInclusive().clear();
            entry.getPermissionInclusive().addAll(update.permissionInclusive());
        }

        Entry saved = entryRepository.saveAndFlush(entry);
        transactionLog.append(id, actorId, TransactionAction.MODIFY);

        EntryDto dto = EntryDto.from(saved);
        refreshAfterCommit(dto);
        return dto;
    }

    /**
     * Soft-deletes {@code id} and everything below it in one statement.
     * A tree that is already fully removed is left as it is.
     */
    @Transactional
    public EntryDto removeEntry(String id, String actorId) {
        return cascadeDeletedFlag(id, actorId, true);
    }

    /**
     * Clears the soft-delete flag on {@code id} and everything below it.
     * Restoring a tree with nothing removed in it changes nothing and records nothing.
     */
    @Transactional
    public EntryDto restoreEntry(String id, String actorId) {
        return cascadeDeletedFlag(id, actorId, false);
    }

    @Transactional
    public EntryDto restoreEntry(String id) {
        return restoreEntry(id, load(id).getAuthorId());
    }

    /**
     * Removes the row of {@code id} for good. Children keep their rows and their parent
     * reference. The entry's own transactions go with it; the deletion itself is kept
     * as a tombstone.
     *
     * @param purgeObject also remove the stored object once the row is gone
     */
    @Transactional
    public void deleteEntry(String id, String actorId, boolean purgeObject) {
        Entry entry = load(id);
        boolean purge = purgeObject && !entry.isDirectory();

        transactionLog.recordDeletion(entry, actorId, purge);
        transactionRepository.deleteByEntryIds(List.of(id));
        entryRepository.delete(entry);

        String authorId = entry.getAuthorId();
        cache.afterCommit(() -> {
            cache.invalidate(CacheKey.entry(id));
            cache.invalidateAll(CacheKind.ENTRIES, authorId);
            if (purge) {
                objectStorage.deleteObject(id);
            }
        });
    }

    @Transactional(readOnly = true)
    public List<TransactionDto> listTransactions(String entryId) {
        getEntry(entryId);
        return transactionLog.transactionsOf(entryId);
    }

    /**
     * Ids of {@code rootId} and all its transitive children, found by expanding one level
     * of {@code parent_id} edges at a time. Ids already collected are never expanded
     * again, so a corrupt cyclic tree still terminates.
     */
    @Transactional(readOnly = true)
    public Set<String> closureOf(String rootId) {
        Set<String> closure = new LinkedHashSet<>();
        closure.add(rootId);
        Set<String> frontier = Set.of(rootId);
        while (!frontier.isEmpty()) {
            Set<String> next = new LinkedHashSet<>();
            for (String childId : entryRepository.findChildIds(frontier)) {
                if (closure.add(childId)) {
                    next.add(childId);
                }
            }
            frontier = next;
        }
        return closure;
    }

    private EntryDto cascadeDeletedFlag(String id, String actorId, boolean deleted) {
        load(id);
        Set<String> closure = closureOf(id);
        long alreadyInState = entryRepository.countByIdInAndDeleted(closure, deleted);
        if (alreadyInState == closure.size()) {
            log.debug("Entry {} and its {} descendant(s) already have deleted={}", id, closure.size() - 1, deleted);
            return getEntry(id);
        }

        Instant now = Instant.now(clock);
        int updated = entryRepository.markDeleted(closure, deleted, deleted ? now : null, now);
        transactionLog.append(id, actorId, deleted ? TransactionAction.REMOVE : TransactionAction.RESTORE);
        log.info("Set deleted={} on {} entries under {}", deleted, updated, id);

        Set<String> authors = Set.copyOf(entryRepository.findAuthorIds(closure));
        EntryDto dto = EntryDto.from(load(id));
        cache.afterCommit(() -> {
            cache.invalidate(closure.stream().map(CacheKey::entry).toArray(CacheKey[]::new));
            authors.forEach(author -> cache.invalidateAll(CacheKind.ENTRIES, author));
            cache.write(CacheKey.entry(id), dto);
        });
        return dto;
    }

    private void checkParent(String id, String parentId) {
        if (Entry.ROOT.equals(parentId)) {
            return;
        }
        load(parentId);
        if (closureOf(id).contains(parentId)) {
            log.warn("Rejected moving entry {} under its own descendant {}", id, parentId);
            throw new InvalidParentException(id, parentId);
        }
    }

    private static boolean changesPermission(Entry entry, EntryUpdate update) {
        return update.permission() != null && update.permission() != entry.getPermission();
    }

    private void refreshAfterCommit(EntryDto dto) {
        cache.afterCommit(() -> {
            cache.invalidateAll(CacheKind.ENTRIES, dto.authorId());
            cache.write(CacheKey.entry(dto.id()), dto);
        });
    }

    private Entry load(String id) {
        return entryRepository.findById(id).orElseThrow(() -> new EntryNotFoundException(id));
    }
}

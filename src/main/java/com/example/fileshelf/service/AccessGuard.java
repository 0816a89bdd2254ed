package com.example.fileshelf.service;

import com.example.fileshelf.dto.EntryDto;
import com.example.fileshelf.entity.Entry;
import com.example.fileshelf.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Request-level checks: the author may always view and modify their entry, everyone
 * else goes through the {@link PermissionEvaluator} table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessGuard {

    private final EntryService entryService;
    private final PermissionEvaluator permissionEvaluator;

    public EntryDto requireView(String entryId, String userId) {
        EntryDto entry = entryService.getEntry(entryId);
        if (!entry.isAuthor(userId) && !permissionEvaluator.canView(entry, userId)) {
            log.warn("User {} denied view of entry {}", userId, entryId);
            throw new AccessDeniedException(entryId, userId, "view");
        }
        return entry;
    }

    public EntryDto requireModify(String entryId, String userId) {
        EntryDto entry = entryService.getEntry(entryId);
        if (!entry.isAuthor(userId) && !permissionEvaluator.canModify(entry, userId)) {
            log.warn("User {} denied modification of entry {}", userId, entryId);
            throw new AccessDeniedException(entryId, userId, "modify");
        }
        return entry;
    }

    /**
     * Adding under a directory counts as modifying it. The root is open to everyone.
     */
    public void requireAddUnder(String parentId, String userId) {
        if (parentId != null && !Entry.ROOT.equals(parentId)) {
            requireModify(parentId, userId);
        }
    }
}

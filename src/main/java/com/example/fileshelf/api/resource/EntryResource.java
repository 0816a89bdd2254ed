package com.example.fileshelf.api.resource;

import com.example.fileshelf.dto.AddEntryResponse;
import com.example.fileshelf.dto.EntryDto;
import com.example.fileshelf.dto.EntryUpdate;
import com.example.fileshelf.dto.MessageResponse;
import com.example.fileshelf.dto.TransactionDto;
import com.example.fileshelf.entity.EntryType;
import com.example.fileshelf.service.AccessGuard;
import com.example.fileshelf.service.EntryService;
import com.example.fileshelf.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for entry metadata. Payload bytes never pass through here: clients
 * upload and download through pre-signed object storage URLs.
 */
@Slf4j
@RestController
@RequestMapping("/entry")
@RequiredArgsConstructor
public class EntryResource {

    private final EntryService entryService;
    private final AccessGuard accessGuard;
    private final ObjectStorage objectStorage;
    private final SessionAuthenticator authenticator;

    /**
     * Lists the caller's finalized entries.
     *
     * @param all      Include entries marked as deleted.
     * @param parentId Only return children of this entry.
     */
    @GetMapping("/metadatas")
    public List<EntryDto> getEntries(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam(defaultValue = "false") boolean all,
            @RequestParam(required = false) String parentId
    ) {
        String userId = authenticator.currentUserId(sessionId);
        return entryService.listEntries(userId, all, parentId);
    }

    @GetMapping("/metadata")
    public EntryDto getEntry(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String id
    ) {
        return accessGuard.requireView(id, authenticator.currentUserId(sessionId));
    }

    /**
     * Returns a pre-signed download URL for the entry's payload.
     */
    @GetMapping("/content")
    public ResponseEntity<String> getEntryContent(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String id
    ) {
        EntryDto entry = accessGuard.requireView(id, authenticator.currentUserId(sessionId));
        return ResponseEntity.ok(objectStorage.presignDownload(entry.id()));
    }

    @GetMapping("/transactions")
    public List<TransactionDto> getTransactions(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String id
    ) {
        accessGuard.requireView(id, authenticator.currentUserId(sessionId));
        return entryService.listTransactions(id);
    }

    /**
     * Creates an entry. Files come back pending together with the URL to upload to;
     * call {@code PUT /entry/finalize} once the upload is done.
     */
    @PostMapping
    public AddEntryResponse addEntry(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String name,
            @RequestParam EntryType type,
            @RequestParam(required = false) String parentId
    ) {
        String userId = authenticator.currentUserId(sessionId);
        accessGuard.requireAddUnder(parentId, userId);
        EntryDto entry = entryService.addEntry(name, type, userId, parentId);
        String uploadUrl = type == EntryType.DIRECTORY ? null : objectStorage.presignUpload(entry.id());
        log.info("User {} added {} entry {}", userId, type, entry.id());
        return new AddEntryResponse(entry, uploadUrl);
    }

    @PutMapping("/finalize")
    public EntryDto finalizeEntry(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String id
    ) {
        String userId = authenticator.currentUserId(sessionId);
        accessGuard.requireModify(id, userId);
        return entryService.finalizeEntry(id, userId);
    }

    @PutMapping("/metadata")
    public EntryDto updateEntry(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String id,
            @RequestBody EntryUpdate update
    ) {
        String userId = authenticator.currentUserId(sessionId);
        accessGuard.requireModify(id, userId);
        if (update.parentId() != null) {
            accessGuard.requireAddUnder(update.parentId(), userId);
        }
        return entryService.updateEntry(id, update, userId);
    }

    /**
     * Marks the entry and its subtree as deleted, or with {@code force} removes the
     * single entry row and its stored object for good.
     */
    @DeleteMapping
    public ResponseEntity<?> removeEntry(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String id,
            @RequestParam(defaultValue = "false") boolean force
    ) {
        String userId = authenticator.currentUserId(sessionId);
        accessGuard.requireModify(id, userId);
        if (!force) {
            return ResponseEntity.ok(entryService.removeEntry(id, userId));
        }
        entryService.deleteEntry(id, userId, true);
        return ResponseEntity.ok(MessageResponse.ok());
    }

    @PutMapping("/restore")
    public EntryDto restoreEntry(
            @CookieValue(name = SessionAuthenticator.COOKIE, required = false) String sessionId,
            @RequestParam String id
    ) {
        String userId = authenticator.currentUserId(sessionId);
        accessGuard.requireModify(id, userId);
        return entryService.restoreEntry(id, userId);
    }
}

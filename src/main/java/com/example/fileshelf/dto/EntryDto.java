package com.example.fileshelf.dto;

import com.example.fileshelf.entity.Entry;
import com.example.fileshelf.entity.EntryPermission;
import com.example.fileshelf.entity.EntryStatus;
import com.example.fileshelf.entity.EntryType;

import java.time.Instant;
import java.util.Set;

/**
 * Immutable snapshot of an {@link Entry}, safe to hand out from the cache.
 */
public record EntryDto(
        String id,
        String name,
        EntryType type,
        EntryStatus status,
        long size,
        String authorId,
        String parentId,
        boolean deleted,
        Instant deletedSince,
        EntryPermission permission,
        Set<String> permissionInclusive,
        Instant createdAt,
        Instant updatedAt
) {

    public EntryDto {
        permissionInclusive = permissionInclusive == null ? Set.of() : Set.copyOf(permissionInclusive);
    }

    public static EntryDto from(Entry entry) {
        return new EntryDto(
                entry.getId(),
                entry.getName(),
                entry.getType(),
                entry.getStatus(),
                entry.getSize(),
                entry.getAuthorId(),
                entry.getParentId(),
                entry.isDeleted(),
                entry.getDeletedSince(),
                entry.getPermission(),
                entry.getPermissionInclusive(),
                entry.getCreatedAt(),
                entry.getUpdatedAt()
        );
    }

    public boolean isAuthor(String userId) {
        return authorId.equals(userId);
    }
}

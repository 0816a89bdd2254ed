package com.example.fileshelf.cache;

import java.util.Objects;

/**
 * Composite cache key: entity kind, identity, and for list queries the filter that
 * produced the result. Keys with the same kind and id form one invalidation group.
 */
public record CacheKey(CacheKind kind, String id, String qualifier) {

    public CacheKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        qualifier = qualifier == null ? "" : qualifier;
    }

    public static CacheKey entry(String entryId) {
        return new CacheKey(CacheKind.ENTRY, entryId, null);
    }

    public static CacheKey entries(String ownerId, boolean includeDeleted, String parentId) {
        return new CacheKey(CacheKind.ENTRIES, ownerId, "all=" + includeDeleted + ";parent=" + (parentId == null ? "*" : parentId));
    }

    public static CacheKey user(String userId) {
        return new CacheKey(CacheKind.USER, userId, null);
    }

    public static CacheKey session(String sessionId) {
        return new CacheKey(CacheKind.SESSION, sessionId, null);
    }

    boolean sameGroup(CacheKind otherKind, String otherId) {
        return kind == otherKind && id.equals(otherId);
    }

    @Override
    public String toString() {
        return qualifier.isEmpty() ? kind + ":" + id : kind + ":" + id + ":" + qualifier;
    }
}

package com.example.fileshelf.dto;

import com.example.fileshelf.entity.EntryPermission;

import java.util.Set;

/**
 * Partial update of an entry. Null fields are left untouched.
 */
public record EntryUpdate(
        String name,
        String parentId,
        EntryPermission permission,
        Set<String> permissionInclusive
) {
}

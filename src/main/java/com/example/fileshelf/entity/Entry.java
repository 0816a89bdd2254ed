package com.example.fileshelf.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A file or directory metadata record. The payload of a file lives in object storage
 * under the entry id; this row only tracks where it sits in the tree and who can see it.
 */
@Entity
@Table(name = "entry", indexes = {
        @Index(name = "idx_entry_author", columnList = "author_id"),
        @Index(name = "idx_entry_parent", columnList = "parent_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Entry {

    public static final String ROOT = "root";

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String name;

    @Builder.Default
    @Column(nullable = false)
    private long size = 0L;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntryType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntryStatus status;

    @Column(name = "author_id", nullable = false, length = 36)
    private String authorId;

    @Builder.Default
    @Column(name = "parent_id", nullable = false, length = 36)
    private String parentId = ROOT;

    @Builder.Default
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    // non-null iff deleted
    @Column(name = "is_deleted_since")
    private Instant deletedSince;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private EntryPermission permission = EntryPermission.PRIVATE;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "entry_permission_inclusive", joinColumns = @JoinColumn(name = "entry_id"))
    @Column(name = "user_id", length = 36)
    private Set<String> permissionInclusive = new HashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isDirectory() {
        return type == EntryType.DIRECTORY;
    }
}

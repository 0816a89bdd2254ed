package com.example.fileshelf.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Audit record of a hard delete. Kept apart from {@link Transaction} because the
 * entry's own transactions are removed along with the entry row.
 */
@Entity
@Table(name = "entry_tombstone", indexes = @Index(name = "idx_tombstone_entry", columnList = "entry_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntryTombstone {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "entry_id", nullable = false, length = 36)
    private String entryId;

    @Column(name = "entry_name", nullable = false)
    private String entryName;

    @Column(name = "author_id", nullable = false, length = 36)
    private String authorId;

    @Column(name = "actor_id", nullable = false, length = 36)
    private String actorId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionAction action = TransactionAction.DELETE;

    @Column(name = "object_purged", nullable = false)
    private boolean objectPurged;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}

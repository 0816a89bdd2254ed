package com.example.fileshelf.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * One audit row per state transition of an {@link Entry}. Rows are never updated;
 * they go away only together with their entry or their actor.
 */
@Entity
@Table(name = "transactions", indexes = {
        @Index(name = "idx_transaction_entry", columnList = "entry_id"),
        @Index(name = "idx_transaction_actor", columnList = "actor_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Transaction {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "entry_id", nullable = false, length = 36)
    private String entryId;

    @Column(name = "actor_id", nullable = false, length = 36)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionAction action;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}

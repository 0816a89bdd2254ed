package com.example.fileshelf.dto;

import com.example.fileshelf.entity.Transaction;
import com.example.fileshelf.entity.TransactionAction;

import java.time.Instant;

public record TransactionDto(String id, String entryId, String actorId, TransactionAction action, Instant createdAt) {

    public static TransactionDto from(Transaction transaction) {
        return new TransactionDto(
                transaction.getId(),
                transaction.getEntryId(),
                transaction.getActorId(),
                transaction.getAction(),
                transaction.getCreatedAt()
        );
    }
}

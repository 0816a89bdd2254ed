package com.example.fileshelf.service;

import com.example.fileshelf.dto.TransactionDto;
import com.example.fileshelf.entity.Entry;
import com.example.fileshelf.entity.EntryTombstone;
import com.example.fileshelf.entity.Transaction;
import com.example.fileshelf.entity.TransactionAction;
import com.example.fileshelf.repository.EntryTombstoneRepository;
import com.example.fileshelf.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Append-only audit writer. Appends join the caller's transaction so the audit row
 * commits or rolls back together with the mutation it describes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionLog {

    private final TransactionRepository transactionRepository;
    private final EntryTombstoneRepository tombstoneRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction append(String entryId, String actorId, TransactionAction action) {
        Transaction transaction = Transaction.builder()
                .id(UUID.randomUUID().toString())
                .entryId(entryId)
                .actorId(actorId)
                .action(action)
                .build();
        Transaction saved = transactionRepository.save(transaction);
        log.info("{} entry {} by {}", action, entryId, actorId);
        return saved;
    }

    /**
     * Records a hard delete. The tombstone outlives the entry and its transactions.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EntryTombstone recordDeletion(Entry entry, String actorId, boolean objectPurged) {
        EntryTombstone tombstone = EntryTombstone.builder()
                .id(UUID.randomUUID().toString())
                .entryId(entry.getId())
                .entryName(entry.getName())
                .authorId(entry.getAuthorId())
                .actorId(actorId)
                .objectPurged(objectPurged)
                .build();
        EntryTombstone saved = tombstoneRepository.save(tombstone);
        log.info("{} entry {} by {} (object purged: {})", TransactionAction.DELETE, entry.getId(), actorId, objectPurged);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<TransactionDto> transactionsOf(String entryId) {
        return transactionRepository.findByEntryIdOrderByCreatedAtAsc(entryId).stream()
                .map(TransactionDto::from)
                .toList();
    }
}

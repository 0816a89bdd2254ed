package com.example.fileshelf.repository;

import com.example.fileshelf.entity.Transaction;
import com.example.fileshelf.entity.TransactionAction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, String> {

    List<Transaction> findByEntryIdOrderByCreatedAtAsc(String entryId);

    long countByEntryIdAndAction(String entryId, TransactionAction action);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Transaction t WHERE t.entryId IN :entryIds")
    int deleteByEntryIds(@Param("entryIds") Collection<String> entryIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Transaction t WHERE t.actorId = :actorId")
    int deleteByActorId(@Param("actorId") String actorId);
}

package com.example.fileshelf.repository;

import com.example.fileshelf.entity.Entry;
import com.example.fileshelf.entity.EntryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface EntryRepository extends JpaRepository<Entry, String> {

    List<Entry> findByAuthorIdAndStatus(String authorId, EntryStatus status);

    List<Entry> findByAuthorIdAndStatusAndDeletedFalse(String authorId, EntryStatus status);

    List<Entry> findByAuthorIdAndStatusAndParentId(String authorId, EntryStatus status, String parentId);

    List<Entry> findByAuthorIdAndStatusAndParentIdAndDeletedFalse(String authorId, EntryStatus status, String parentId);

    List<Entry> findByAuthorId(String authorId);

    long countByIdInAndDeleted(Collection<String> ids, boolean deleted);

    @Query("SELECT DISTINCT e.authorId FROM Entry e WHERE e.id IN :ids")
    List<String> findAuthorIds(@Param("ids") Collection<String> ids);

    @Query("SELECT e.id FROM Entry e WHERE e.parentId IN :parentIds")
    List<String> findChildIds(@Param("parentIds") Collection<String> parentIds);

    /**
     * Flips the soft-delete flag on every listed entry in one statement.
     * {@code deletedSince} must be null when {@code deleted} is false.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Entry e SET e.deleted = :deleted, e.deletedSince = :deletedSince, e.updatedAt = :now "
            + "WHERE e.id IN :ids")
    int markDeleted(@Param("ids") Collection<String> ids,
                    @Param("deleted") boolean deleted,
                    @Param("deletedSince") Instant deletedSince,
                    @Param("now") Instant now);
}

package com.example.fileshelf.repository;

import com.example.fileshelf.entity.EntryTombstone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EntryTombstoneRepository extends JpaRepository<EntryTombstone, String> {

    List<EntryTombstone> findByEntryId(String entryId);
}

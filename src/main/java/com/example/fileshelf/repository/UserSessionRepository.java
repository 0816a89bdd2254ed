package com.example.fileshelf.repository;

import com.example.fileshelf.entity.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, String> {

    @Query("SELECT s.id FROM UserSession s WHERE s.userId = :userId")
    List<String> findIdsByUserId(@Param("userId") String userId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM UserSession s WHERE s.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}

package com.todo.repository;

import com.todo.entity.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("SELECT s FROM UserSession s " +
           "WHERE s.user.id = :userId AND s.isActive = true AND s.expiresAt > :now " +
           "ORDER BY s.lastActivity DESC")
    List<UserSession> findActiveByUserId(@Param("userId") UUID userId, @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE UserSession s SET s.isActive = false WHERE s.user.id = :userId AND s.isActive = true")
    int deactivateAllByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query("UPDATE UserSession s SET s.isActive = false " +
           "WHERE s.user.id = :userId AND s.isActive = true AND s.id <> :keepSessionId")
    int deactivateAllByUserIdExcept(@Param("userId") UUID userId, @Param("keepSessionId") UUID keepSessionId);

    @Modifying
    @Query("UPDATE UserSession s SET s.lastActivity = :now WHERE s.id = :sessionId")
    int touch(@Param("sessionId") UUID sessionId, @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM UserSession s WHERE s.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

package com.todo.repository;

import com.todo.entity.NotificationLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationLogRepository extends JpaRepository<NotificationLog, UUID> {

    @Query("SELECT l FROM NotificationLog l WHERE l.user.id = :userId ORDER BY l.createdAt DESC")
    List<NotificationLog> findRecentByUserId(@Param("userId") UUID userId, Pageable pageable);

    @Query("SELECT COUNT(l) FROM NotificationLog l WHERE l.user.id = :userId AND l.readAt IS NULL")
    long countUnreadByUserId(@Param("userId") UUID userId);

    /**
     * Number of successful deliveries of the rule after {@code since}.
     */
    @Query("SELECT COUNT(l) FROM NotificationLog l " +
           "WHERE l.rule.id = :ruleId AND l.status = com.todo.entity.NotificationLog.Status.SENT " +
           "AND l.createdAt > :since")
    long countSentSince(@Param("ruleId") UUID ruleId, @Param("since") LocalDateTime since);

    @Modifying
    @Query("UPDATE NotificationLog l SET l.readAt = :now WHERE l.user.id = :userId AND l.readAt IS NULL")
    int markAllReadByUserId(@Param("userId") UUID userId, @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE NotificationLog l " +
           "SET l.status = com.todo.entity.NotificationLog.Status.FAILED, l.errorMessage = :reason " +
           "WHERE l.task.id = :taskId AND l.status = com.todo.entity.NotificationLog.Status.PENDING")
    int failPendingByTaskId(@Param("taskId") UUID taskId, @Param("reason") String reason);

    @Modifying
    @Query("UPDATE NotificationLog l SET l.task = null, l.rule = null WHERE l.task.id = :taskId")
    int detachFromTask(@Param("taskId") UUID taskId);

    @Modifying
    @Query("UPDATE NotificationLog l SET l.rule = null WHERE l.rule.id = :ruleId")
    int detachFromRule(@Param("ruleId") UUID ruleId);

    @Modifying
    @Query("DELETE FROM NotificationLog l WHERE l.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

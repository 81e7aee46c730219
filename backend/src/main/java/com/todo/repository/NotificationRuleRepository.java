package com.todo.repository;

import com.todo.entity.NotificationRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRuleRepository extends JpaRepository<NotificationRule, UUID> {

    List<NotificationRule> findByTaskIdOrderByCreatedAtAsc(UUID taskId);

    /**
     * Candidate rules for the reminder scan: enabled, never sent, attached to an
     * incomplete task due at or after {@code dueFrom}. There is no upper bound
     * since a rule's offset can be arbitrarily long; the exact due check is
     * {@link NotificationRule#isDueAt}.
     */
    @Query("SELECT r FROM NotificationRule r " +
           "JOIN FETCH r.task t " +
           "WHERE r.isEnabled = true AND r.lastSentAt IS NULL " +
           "AND t.isCompleted = false AND t.dueDate IS NOT NULL " +
           "AND t.dueDate >= :dueFrom")
    List<NotificationRule> findScanCandidates(@Param("dueFrom") LocalDateTime dueFrom);

    @Modifying
    @Query("DELETE FROM NotificationRule r WHERE r.task.id = :taskId")
    int deleteByTaskId(@Param("taskId") UUID taskId);

    @Modifying
    @Query("DELETE FROM NotificationRule r WHERE r.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

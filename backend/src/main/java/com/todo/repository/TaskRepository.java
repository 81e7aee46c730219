package com.todo.repository;

import com.todo.entity.Task;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for {@link Task} entities.
 *
 * Filtered and sorted listings go through {@link JpaSpecificationExecutor} with
 * the predicates in {@link TaskSpecifications}; the fixed-shape counts used by the
 * navigation sidebar are plain JPQL queries.
 *
 * All queries take the owning user's id. There is deliberately no unscoped
 * finder other than {@code findById}, which callers follow with an ownership check.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, UUID>, JpaSpecificationExecutor<Task> {

    List<Task> findByUserIdOrderByCreatedAtDesc(UUID userId);

    long countByUserId(UUID userId);

    long countByUserIdAndIsCompleted(UUID userId, Boolean isCompleted);

    long countByUserIdAndProjectIsNullAndIsCompletedFalse(UUID userId);

    /**
     * Counts incomplete tasks due in {@code [from, to)}.
     */
    @Query("SELECT COUNT(t) FROM Task t " +
           "WHERE t.user.id = :userId AND t.isCompleted = false " +
           "AND t.dueDate >= :from AND t.dueDate < :to")
    long countIncompleteDueBetween(@Param("userId") UUID userId,
                                   @Param("from") LocalDateTime from,
                                   @Param("to") LocalDateTime to);

    @Query("SELECT COUNT(t) FROM Task t " +
           "WHERE t.user.id = :userId AND t.isCompleted = false AND t.dueDate < :before")
    long countIncompleteDueBefore(@Param("userId") UUID userId, @Param("before") LocalDateTime before);

    @Query("SELECT COUNT(t) FROM Task t " +
           "WHERE t.user.id = :userId AND t.isCompleted = false AND t.dueDate >= :from")
    long countIncompleteDueFrom(@Param("userId") UUID userId, @Param("from") LocalDateTime from);

    /**
     * Incomplete task count per project, as {@code [projectId, count]} rows.
     * Projects without incomplete tasks are absent.
     */
    @Query("SELECT t.project.id, COUNT(t) FROM Task t " +
           "WHERE t.user.id = :userId AND t.isCompleted = false AND t.project IS NOT NULL " +
           "GROUP BY t.project.id")
    List<Object[]> countIncompleteGroupedByProject(@Param("userId") UUID userId);

    /**
     * Task count per tag, as {@code [tagId, count]} rows.
     */
    @Query("SELECT tg.id, COUNT(t) FROM Task t JOIN t.tags tg " +
           "WHERE t.user.id = :userId " +
           "GROUP BY tg.id")
    List<Object[]> countGroupedByTag(@Param("userId") UUID userId);

    @Query("SELECT DISTINCT t.title FROM Task t " +
           "WHERE t.user.id = :userId AND LOWER(t.title) LIKE :pattern ESCAPE '\\' " +
           "ORDER BY t.title")
    List<String> findTitleSuggestions(@Param("userId") UUID userId,
                                      @Param("pattern") String pattern,
                                      Pageable pageable);

    @Modifying
    @Query("UPDATE Task t SET t.project = null WHERE t.project.id IN :projectIds")
    int detachFromProjects(@Param("projectIds") Collection<UUID> projectIds);

    @Modifying
    @Query(value = "DELETE FROM task_tags WHERE task_id IN (SELECT id FROM tasks WHERE user_id = :userId)",
           nativeQuery = true)
    int deleteTagLinksByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query(value = "DELETE FROM subtasks WHERE task_id IN (SELECT id FROM tasks WHERE user_id = :userId)",
           nativeQuery = true)
    int deleteSubtasksByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query("DELETE FROM Task t WHERE t.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

package com.todo.repository;

import com.todo.entity.Tag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TagRepository extends JpaRepository<Tag, UUID> {

    List<Tag> findByUserIdOrderByNameAsc(UUID userId);

    List<Tag> findByUserIdAndIdIn(UUID userId, Collection<UUID> ids);

    long countByUserId(UUID userId);

    boolean existsByUserIdAndNameIgnoreCase(UUID userId, String name);

    boolean existsByUserIdAndNameIgnoreCaseAndIdNot(UUID userId, String name, UUID id);

    /**
     * Removes the tag from every task carrying it.
     */
    @Modifying
    @Query(value = "DELETE FROM task_tags WHERE tag_id = :tagId", nativeQuery = true)
    int detachFromTasks(@Param("tagId") UUID tagId);

    @Modifying
    @Query("DELETE FROM Tag t WHERE t.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

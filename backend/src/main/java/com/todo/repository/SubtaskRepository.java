package com.todo.repository;

import com.todo.entity.Subtask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SubtaskRepository extends JpaRepository<Subtask, UUID> {

    List<Subtask> findByTaskIdOrderByPositionAsc(UUID taskId);

    @Query("SELECT MAX(s.position) FROM Subtask s WHERE s.task.id = :taskId")
    Integer findMaxPosition(@Param("taskId") UUID taskId);
}

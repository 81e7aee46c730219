package com.todo.repository;

import com.todo.entity.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProjectRepository extends JpaRepository<Project, UUID> {

    List<Project> findByUserIdOrderByNameAsc(UUID userId);

    @Query("SELECT p FROM Project p WHERE p.user.id = :userId ORDER BY p.isFavorite DESC, p.name ASC")
    List<Project> findByUserIdFavoritesFirst(@Param("userId") UUID userId);

    List<Project> findByParentId(UUID parentId);

    long countByUserId(UUID userId);

    boolean existsByUserIdAndNameIgnoreCase(UUID userId, String name);

    boolean existsByUserIdAndNameIgnoreCaseAndIdNot(UUID userId, String name, UUID id);

    @Modifying
    @Query("UPDATE Project p SET p.parent = null WHERE p.user.id = :userId")
    int clearParentsByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query("DELETE FROM Project p WHERE p.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

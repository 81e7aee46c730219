package com.todo.repository;

import com.todo.entity.SavedView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SavedViewRepository extends JpaRepository<SavedView, UUID> {

    List<SavedView> findByUserIdOrderByNameAsc(UUID userId);

    long countByUserId(UUID userId);

    /**
     * Clears the default flag on every view of the user except the given one.
     */
    @Modifying
    @Query("UPDATE SavedView v SET v.isDefault = false " +
           "WHERE v.user.id = :userId AND v.isDefault = true AND v.id <> :keepId")
    int clearDefaultExcept(@Param("userId") UUID userId, @Param("keepId") UUID keepId);

    @Modifying
    @Query("DELETE FROM SavedView v WHERE v.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

package com.todo.repository;

import com.todo.entity.UserNotificationSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserNotificationSettingRepository extends JpaRepository<UserNotificationSetting, UUID> {

    Optional<UserNotificationSetting> findByUserId(UUID userId);

    @Modifying
    @Query("DELETE FROM UserNotificationSetting s WHERE s.user.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}

package com.todo.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-user notification switches and the defaults applied to new reminder rules.
 * One row per user, created on first access.
 */
@Entity
@Table(name = "user_notification_settings", indexes = {
    @Index(name = "idx_notification_setting_user", columnList = "user_id", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserNotificationSetting {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true,
            foreignKey = @ForeignKey(name = "fk_notification_setting_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @Column(name = "email_notifications_enabled", nullable = false)
    private Boolean emailNotificationsEnabled = true;

    @Column(name = "in_app_notifications_enabled", nullable = false)
    private Boolean inAppNotificationsEnabled = true;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone = "UTC";

    @Column(name = "default_reminder_offset", nullable = false)
    private Integer defaultReminderOffset = NotificationRule.DEFAULT_OFFSET;

    @Enumerated(EnumType.STRING)
    @Column(name = "default_reminder_unit", nullable = false, length = 10)
    private NotificationRule.ReminderUnit defaultReminderUnit = NotificationRule.ReminderUnit.MINUTES;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public UserNotificationSetting(User user) {
        this.user = user;
    }

    /**
     * e.g. "30 minutes before due".
     */
    public String getDefaultReminderText() {
        return defaultReminderUnit.describe(defaultReminderOffset) + " before due";
    }
}

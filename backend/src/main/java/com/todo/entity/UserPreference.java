package com.todo.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Display, notification and accessibility preferences of a user.
 *
 * Exactly one row exists per user. It is created at registration and lazily
 * re-created by the services when missing, so readers can always assume a
 * complete set of defaults.
 */
@Entity
@Table(name = "user_preferences", indexes = {
    @Index(name = "idx_preference_user", columnList = "user_id", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserPreference {

    public static final String DEFAULT_THEME = "system";
    public static final String DEFAULT_LANGUAGE = "en";
    public static final BigDecimal DEFAULT_FONT_SCALE = new BigDecimal("1.00");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true,
            foreignKey = @ForeignKey(name = "fk_preference_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @Column(name = "theme", nullable = false, length = 10)
    private String theme = DEFAULT_THEME;

    @Column(name = "language", nullable = false, length = 5)
    private String language = DEFAULT_LANGUAGE;

    @Column(name = "calendar_type", nullable = false, length = 10)
    private String calendarType = "gregorian";

    @Column(name = "email_notifications", nullable = false)
    private Boolean emailNotifications = true;

    @Column(name = "push_notifications", nullable = false)
    private Boolean pushNotifications = true;

    @Column(name = "task_reminders", nullable = false)
    private Boolean taskReminders = true;

    @Column(name = "daily_digest", nullable = false)
    private Boolean dailyDigest = false;

    @Column(name = "weekly_digest", nullable = false)
    private Boolean weeklyDigest = false;

    @Column(name = "marketing_emails", nullable = false)
    private Boolean marketingEmails = false;

    @Column(name = "session_timeout", nullable = false)
    private Integer sessionTimeout = 60;

    @Column(name = "items_per_page", nullable = false)
    private Integer itemsPerPage = 20;

    @Column(name = "date_format", nullable = false, length = 20)
    private String dateFormat = "yyyy-MM-dd";

    @Column(name = "time_format", nullable = false, length = 20)
    private String timeFormat = "HH:mm";

    @Column(name = "start_of_week", nullable = false)
    private Integer startOfWeek = 1;

    @Column(name = "default_task_view", nullable = false, length = 10)
    private String defaultTaskView = "list";

    @Column(name = "show_week_numbers", nullable = false)
    private Boolean showWeekNumbers = false;

    @Column(name = "reduced_motion", nullable = false)
    private Boolean reducedMotion = false;

    @Column(name = "high_contrast", nullable = false)
    private Boolean highContrast = false;

    @Column(name = "font_scale", nullable = false, precision = 3, scale = 2)
    private BigDecimal fontScale = DEFAULT_FONT_SCALE;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public UserPreference(User user) {
        this.user = user;
    }

    /**
     * Restores the theme and accessibility settings to their defaults.
     * Notification and layout settings are left untouched.
     */
    public void resetTheme() {
        this.theme = DEFAULT_THEME;
        this.language = DEFAULT_LANGUAGE;
        this.reducedMotion = false;
        this.highContrast = false;
        this.fontScale = DEFAULT_FONT_SCALE;
    }
}

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
import java.util.Locale;
import java.util.UUID;

/**
 * Entity representing a reminder attached to a task.
 *
 * A rule fires once, {@code reminderOffset} {@code reminderUnit}s before the
 * task's due date, on the configured channel. Whether a rule is due is a pure
 * function of the task due date, the rule settings, {@code lastSentAt} and the
 * instant being evaluated, so it can be checked without touching the database.
 *
 * <p>Due window: a rule is due from its reminder instant (inclusive) until the
 * window length has elapsed (exclusive). Scans that run less often than the
 * window length therefore may miss a reminder.
 *
 * @see com.todo.entity.NotificationLog
 * @see com.todo.scheduler.NotificationReminderScheduler
 */
@Entity
@Table(name = "notification_rules", indexes = {
    @Index(name = "idx_rule_task", columnList = "task_id"),
    @Index(name = "idx_rule_user", columnList = "user_id"),
    @Index(name = "idx_rule_enabled_sent", columnList = "is_enabled, last_sent_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRule {

    public static final int DEFAULT_OFFSET = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_rule_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false, foreignKey = @ForeignKey(name = "fk_rule_task"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Task task;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 10)
    private Channel channel = Channel.EMAIL;

    @Column(name = "reminder_offset", nullable = false)
    private Integer reminderOffset = DEFAULT_OFFSET;

    @Enumerated(EnumType.STRING)
    @Column(name = "reminder_unit", nullable = false, length = 10)
    private ReminderUnit reminderUnit = ReminderUnit.MINUTES;

    @Column(name = "is_enabled", nullable = false)
    private Boolean isEnabled = true;

    @Column(name = "last_sent_at")
    private LocalDateTime lastSentAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public NotificationRule(User user, Task task, Channel channel, Integer reminderOffset, ReminderUnit reminderUnit) {
        this.user = user;
        this.task = task;
        this.channel = channel;
        this.reminderOffset = reminderOffset;
        this.reminderUnit = reminderUnit;
        this.isEnabled = true;
    }

    /**
     * Delivery channels. Only EMAIL and IN_APP are delivered; the others are
     * accepted and recorded as failed deliveries.
     */
    public enum Channel {
        EMAIL("Email"),
        SMS("SMS"),
        PUSH("Push Notification"),
        IN_APP("In-App");

        private final String label;

        Channel(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Channel fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Channel cannot be null");
            }
            return Channel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum ReminderUnit {
        MINUTES("minute"),
        HOURS("hour"),
        DAYS("day");

        private final String singular;

        ReminderUnit(String singular) {
            this.singular = singular;
        }

        /**
         * Renders an amount of this unit, e.g. "1 hour" or "30 minutes".
         */
        public String describe(int amount) {
            return amount + " " + singular + (amount > 1 ? "s" : "");
        }

        public LocalDateTime subtractFrom(LocalDateTime dateTime, int amount) {
            switch (this) {
                case HOURS:
                    return dateTime.minusHours(amount);
                case DAYS:
                    return dateTime.minusDays(amount);
                default:
                    return dateTime.minusMinutes(amount);
            }
        }

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static ReminderUnit fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Reminder unit cannot be null");
            }
            return ReminderUnit.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Instant at which the reminder should fire.
     *
     * @return due date minus the offset, or null when the task has no due date
     */
    public LocalDateTime getReminderDateTime() {
        if (task == null || task.getDueDate() == null) {
            return null;
        }
        return reminderUnit.subtractFrom(task.getDueDate(), reminderOffset);
    }

    /**
     * Evaluates whether the reminder should be sent at the given instant.
     *
     * @param now the instant to evaluate against
     * @param windowMinutes length of the due window
     * @return true if never sent and {@code now} lies inside the due window
     */
    public boolean isDueAt(LocalDateTime now, long windowMinutes) {
        if (lastSentAt != null) {
            return false;
        }
        LocalDateTime reminderAt = getReminderDateTime();
        if (reminderAt == null) {
            return false;
        }
        return !now.isBefore(reminderAt) && now.isBefore(reminderAt.plusMinutes(windowMinutes));
    }

    /**
     * Human readable lead time, e.g. "in 30 minutes".
     */
    public String getReminderText() {
        return "in " + reminderUnit.describe(reminderOffset);
    }

    public void toggle() {
        this.isEnabled = !Boolean.TRUE.equals(this.isEnabled);
    }

    public boolean isOwnedBy(UUID userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }
}

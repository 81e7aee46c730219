package com.todo.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Delivery record of a single reminder. Doubles as the user's notification inbox:
 * {@code readAt} is set when the user acknowledges it.
 *
 * The rule and task references are cleared when those rows are deleted; the
 * metadata keeps enough context (task title, offset, due date) to render history.
 */
@Entity
@Table(name = "notification_logs", indexes = {
    @Index(name = "idx_log_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_log_rule_status", columnList = "notification_rule_id, status"),
    @Index(name = "idx_log_task", columnList = "task_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "notification_rule_id", foreignKey = @ForeignKey(name = "fk_log_rule"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private NotificationRule rule;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_log_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "task_id", foreignKey = @ForeignKey(name = "fk_log_task"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Task task;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 10)
    private NotificationRule.Channel channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private Status status = Status.PENDING;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public NotificationLog(NotificationRule rule, User user, Task task, Map<String, Object> metadata) {
        this.rule = rule;
        this.user = user;
        this.task = task;
        this.channel = rule.getChannel();
        this.status = Status.PENDING;
        this.metadata = metadata;
    }

    public enum Status {
        PENDING("Pending"),
        SENT("Sent"),
        FAILED("Failed");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public void markAsSent() {
        this.status = Status.SENT;
        this.sentAt = LocalDateTime.now();
        this.errorMessage = null;
    }

    public void markAsFailed(String errorMessage) {
        this.status = Status.FAILED;
        this.errorMessage = errorMessage;
    }

    public void markAsRead() {
        if (this.readAt == null) {
            this.readAt = LocalDateTime.now();
        }
    }

    public boolean isOwnedBy(UUID userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }
}

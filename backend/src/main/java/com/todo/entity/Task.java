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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Entity representing a user's task.
 *
 * A task belongs to exactly one user, optionally to one of that user's projects,
 * and may carry any number of the user's tags. Subtasks are owned by the task and
 * removed with it.
 *
 * Completion state is kept consistent through {@link #setCompletion(boolean)}:
 * marking a task completed stamps {@code completedAt}, reopening it clears the
 * stamp. Callers should never set the two fields independently.
 *
 * @see com.todo.entity.Subtask
 * @see com.todo.entity.Project
 * @see com.todo.entity.Tag
 */
@Entity
@Table(name = "tasks", indexes = {
    @Index(name = "idx_task_user", columnList = "user_id"),
    @Index(name = "idx_task_user_completed", columnList = "user_id, is_completed"),
    @Index(name = "idx_task_project", columnList = "project_id"),
    @Index(name = "idx_task_due_date", columnList = "due_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_task_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_id", foreignKey = @ForeignKey(name = "fk_task_project"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Project project;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private Priority priority = Priority.MEDIUM;

    @Column(name = "due_date")
    private LocalDateTime dueDate;

    @Column(name = "is_completed", nullable = false)
    private Boolean isCompleted = false;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "task_tags",
            joinColumns = @JoinColumn(name = "task_id", foreignKey = @ForeignKey(name = "fk_task_tags_task")),
            inverseJoinColumns = @JoinColumn(name = "tag_id", foreignKey = @ForeignKey(name = "fk_task_tags_tag"))
    )
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Set<Tag> tags = new LinkedHashSet<>();

    @OneToMany(mappedBy = "task", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<Subtask> subtasks = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public Task(User user, String title) {
        this.user = user;
        this.title = title;
    }

    /**
     * Priority levels. Stored by name, exposed to clients in lower case.
     */
    public enum Priority {
        LOW("Low", 3),
        MEDIUM("Medium", 2),
        HIGH("High", 1);

        private final String label;

        private final int rank;

        Priority(String label, int rank) {
            this.label = label;
            this.rank = rank;
        }

        public String getLabel() {
            return label;
        }

        /**
         * Sort rank, 1 being the most urgent.
         */
        public int getRank() {
            return rank;
        }

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Parses the client representation of a priority.
         *
         * @param value "low", "medium" or "high", case-insensitive
         * @return the matching priority
         * @throws IllegalArgumentException if the value is unknown
         */
        public static Priority fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Priority cannot be null");
            }
            return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Applies a completion change.
     *
     * @param completed the new completion state
     */
    public void setCompletion(boolean completed) {
        if (completed && !Boolean.TRUE.equals(this.isCompleted)) {
            this.completedAt = LocalDateTime.now();
        } else if (!completed) {
            this.completedAt = null;
        }
        this.isCompleted = completed;
    }

    public void replaceTags(Set<Tag> newTags) {
        this.tags.clear();
        this.tags.addAll(newTags);
    }

    /**
     * Percentage of completed subtasks, rounded to the nearest integer.
     *
     * @return 0..100, and 0 when the task has no subtasks
     */
    public int getSubtaskProgress() {
        if (subtasks == null || subtasks.isEmpty()) {
            return 0;
        }
        long completed = subtasks.stream().filter(s -> Boolean.TRUE.equals(s.getIsCompleted())).count();
        return (int) Math.round(completed * 100.0 / subtasks.size());
    }

    public boolean isAllSubtasksCompleted() {
        return subtasks != null
                && !subtasks.isEmpty()
                && subtasks.stream().allMatch(s -> Boolean.TRUE.equals(s.getIsCompleted()));
    }

    public boolean isOverdueAt(LocalDateTime now) {
        return dueDate != null && dueDate.isBefore(now) && !Boolean.TRUE.equals(isCompleted);
    }

    public boolean isOwnedBy(UUID userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }
}

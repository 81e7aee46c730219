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
 * Entity representing a project, a named bucket for tasks.
 *
 * Projects may nest under a parent project owned by the same user. Names are
 * unique per user. Removing a project removes its descendants; tasks that
 * pointed at any of them are kept and simply lose their project.
 */
@Entity
@Table(name = "projects",
        uniqueConstraints = {
            @UniqueConstraint(name = "uk_project_user_name", columnNames = {"user_id", "name"})
        },
        indexes = {
            @Index(name = "idx_project_user", columnList = "user_id"),
            @Index(name = "idx_project_parent", columnList = "parent_id")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Project {

    public static final String DEFAULT_COLOR = "#3B82F6";
    public static final String DEFAULT_ICON = "folder";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_project_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id", foreignKey = @ForeignKey(name = "fk_project_parent"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Project parent;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "color", nullable = false, length = 20)
    private String color = DEFAULT_COLOR;

    @Column(name = "icon", nullable = false, length = 50)
    private String icon = DEFAULT_ICON;

    @Column(name = "is_favorite", nullable = false)
    private Boolean isFavorite = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public Project(User user, String name) {
        this.user = user;
        this.name = name;
    }

    public boolean isOwnedBy(UUID userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }
}

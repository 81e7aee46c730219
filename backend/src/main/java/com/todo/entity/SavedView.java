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
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Entity representing a named, persisted task query.
 *
 * The filter and sort definitions are stored as JSON and interpreted only when
 * the view is read (see {@code TaskQueryService#findForSavedView}), so a view
 * keeps working as the underlying tasks change.
 *
 * <p>Example filters:
 * <pre>
 * {
 *   "search": "report",
 *   "priority": "high",
 *   "is_completed": false,
 *   "tag_id": "8f1c...",
 *   "project_id": "2b7e...",
 *   "due_date": {"from": "2024-03-01", "to": "2024-03-31"}
 * }
 * </pre>
 *
 * <p>Example sort order:
 * <pre>
 * {"field": "due_date", "direction": "asc"}
 * </pre>
 */
@Entity
@Table(name = "saved_views", indexes = {
    @Index(name = "idx_saved_view_user", columnList = "user_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SavedView {

    public static final String DEFAULT_ICON = "view_list";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_saved_view_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "filters", columnDefinition = "jsonb")
    private Map<String, Object> filters = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "sort_order", columnDefinition = "jsonb")
    private Map<String, Object> sortOrder;

    @Enumerated(EnumType.STRING)
    @Column(name = "display_mode", nullable = false, length = 10)
    private DisplayMode displayMode = DisplayMode.LIST;

    @Column(name = "icon", nullable = false, length = 50)
    private String icon = DEFAULT_ICON;

    @Column(name = "is_default", nullable = false)
    private Boolean isDefault = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public SavedView(User user, String name) {
        this.user = user;
        this.name = name;
    }

    public enum DisplayMode {
        LIST,
        CALENDAR,
        BOARD;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static DisplayMode fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Display mode cannot be null");
            }
            return DisplayMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public boolean isOwnedBy(UUID userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }
}

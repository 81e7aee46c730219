package com.todo.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.BindParam;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Raw query string of the task list and search endpoints, bound by constructor
 * from the snake_case parameter names and checked field by field with bean
 * validation. Cross-field rules are applied by {@link TaskListParams}.
 *
 * Example:
 * <pre>
 * GET /api/tasks?status=pending&priority=high&due_date_from=2024-03-01&sort_by=due_date&sort_order=asc&per_page=50
 * </pre>
 */
@Getter
@ToString
public class TaskListQuery {

    static final String UUID_OR_NULL =
            "(?i)null|[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    @Size(max = TaskListParams.MAX_QUERY_LENGTH, message = "{validation.q.max}")
    private final String q;

    @Size(max = TaskListParams.MAX_QUERY_LENGTH, message = "{validation.search.max}")
    private final String search;

    @Pattern(regexp = "(?i)low|medium|high", message = "{validation.priority.invalid}")
    private final String priority;

    @Pattern(regexp = "(?i)pending|completed|all", message = "{validation.status.invalid}")
    private final String status;

    private final Boolean isCompleted;

    private final UUID tagId;

    /**
     * A project id, or the literal {@code null} for tasks without a project.
     */
    @Pattern(regexp = UUID_OR_NULL, message = "{validation.project_id.invalid}")
    private final String projectId;

    private final LocalDate dueDate;

    private final LocalDate dueDateFrom;

    private final LocalDate dueDateTo;

    @Min(value = 1, message = "{validation.page.min}")
    private final Integer page;

    @Min(value = 1, message = "{validation.per_page.between}")
    @Max(value = TaskListParams.MAX_PER_PAGE, message = "{validation.per_page.between}")
    private final Integer perPage;

    @Pattern(regexp = "(?i)relevance|priority|due_date|created_at|title", message = "{validation.sort_by.invalid}")
    private final String sortBy;

    @Pattern(regexp = "(?i)asc|desc", message = "{validation.sort_order.invalid}")
    private final String sortOrder;

    @Builder
    public TaskListQuery(String q,
                         String search,
                         String priority,
                         String status,
                         @BindParam("is_completed") Boolean isCompleted,
                         @BindParam("tag_id") UUID tagId,
                         @BindParam("project_id") String projectId,
                         @BindParam("due_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueDate,
                         @BindParam("due_date_from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueDateFrom,
                         @BindParam("due_date_to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueDateTo,
                         Integer page,
                         @BindParam("per_page") Integer perPage,
                         @BindParam("sort_by") String sortBy,
                         @BindParam("sort_order") String sortOrder) {
        this.q = q;
        this.search = search;
        this.priority = priority;
        this.status = status;
        this.isCompleted = isCompleted;
        this.tagId = tagId;
        this.projectId = projectId;
        this.dueDate = dueDate;
        this.dueDateFrom = dueDateFrom;
        this.dueDateTo = dueDateTo;
        this.page = page;
        this.perPage = perPage;
        this.sortBy = sortBy;
        this.sortOrder = sortOrder;
    }
}

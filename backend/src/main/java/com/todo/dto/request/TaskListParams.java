package com.todo.dto.request;

import com.todo.entity.Task;
import com.todo.exception.ValidationException;
import com.todo.repository.TaskFilter;
import com.todo.repository.TaskSort;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Resolved parameters of the task list and search endpoints: the filter, the
 * page window and the ordering, built from a field-validated {@link TaskListQuery}.
 *
 * Only the rules that span several parameters or depend on the endpoint are
 * checked here; each violation is reported under its parameter name.
 */
@Getter
@Builder
public class TaskListParams {

    public static final int DEFAULT_PER_PAGE = 15;
    public static final int MAX_PER_PAGE = 100;
    public static final int MAX_QUERY_LENGTH = 255;

    private final TaskFilter filter;

    private final int page;

    private final int perPage;

    private final TaskSort sortBy;

    private final boolean ascending;

    /**
     * Search text; only set for search requests.
     */
    private final String query;

    /**
     * Task listing. {@code sort_by=relevance} is rejected.
     */
    public static TaskListParams forList(TaskListQuery query) {
        return resolve(query, false);
    }

    /**
     * Search; {@code q} is required and the default sort is relevance.
     */
    public static TaskListParams forSearch(TaskListQuery query) {
        return resolve(query, true);
    }

    private static TaskListParams resolve(TaskListQuery query, boolean search) {
        Map<String, String> errors = new LinkedHashMap<>();
        TaskFilter filter = new TaskFilter();

        String text = null;
        if (search) {
            text = trimToNull(query.getQ());
            if (text == null) {
                errors.put("q", "validation.q.required");
            }
            filter.setSearch(text);
        } else {
            filter.setSearch(trimToNull(query.getSearch()));
        }

        if (query.getPriority() != null) {
            filter.setPriority(Task.Priority.fromValue(query.getPriority()));
        }

        String status = query.getStatus() == null ? "all" : query.getStatus().toLowerCase(Locale.ROOT);
        if ("pending".equals(status)) {
            filter.setIsCompleted(false);
        } else if ("completed".equals(status)) {
            filter.setIsCompleted(true);
        }
        if (query.getIsCompleted() != null) {
            filter.setIsCompleted(query.getIsCompleted());
        }

        filter.setTagId(query.getTagId());
        if ("null".equalsIgnoreCase(query.getProjectId())) {
            filter.setWithoutProject(true);
        } else if (query.getProjectId() != null) {
            filter.setProjectId(UUID.fromString(query.getProjectId()));
        }

        filter.setDueOn(query.getDueDate());
        filter.setDueFrom(query.getDueDateFrom());
        filter.setDueTo(query.getDueDateTo());
        if (filter.getDueFrom() != null && filter.getDueTo() != null && filter.getDueTo().isBefore(filter.getDueFrom())) {
            errors.put("due_date_to", "validation.due_date_to.after_or_equal");
        }

        TaskSort sortBy = search ? TaskSort.RELEVANCE : TaskSort.CREATED_AT;
        if (query.getSortBy() != null) {
            TaskSort parsed = TaskSort.fromKey(query.getSortBy());
            if (parsed == TaskSort.RELEVANCE && !search) {
                errors.put("sort_by", "validation.sort_by.invalid");
            } else {
                sortBy = parsed;
            }
        }

        if (!errors.isEmpty()) {
            throw ValidationException.ofFields(errors);
        }

        return TaskListParams.builder()
                .filter(filter)
                .page(query.getPage() == null ? 1 : query.getPage())
                .perPage(query.getPerPage() == null ? DEFAULT_PER_PAGE : query.getPerPage())
                .sortBy(sortBy)
                .ascending("asc".equalsIgnoreCase(query.getSortOrder()))
                .query(text)
                .build();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

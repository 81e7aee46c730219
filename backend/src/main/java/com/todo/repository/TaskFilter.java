package com.todo.repository;

import com.todo.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Criteria for task listings. Every field is optional; a null field does not
 * constrain the result. Built from query parameters by the task controllers and
 * from stored JSON by saved views.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskFilter {

    private String search;

    private Task.Priority priority;

    @Builder.Default
    private List<Task.Priority> priorities = new ArrayList<>();

    private Boolean isCompleted;

    private UUID tagId;

    private UUID projectId;

    /**
     * Restricts to tasks without a project. Takes precedence over {@link #projectId}.
     */
    private boolean withoutProject;

    private LocalDate dueOn;

    private LocalDate dueFrom;

    private LocalDate dueTo;

    /**
     * Echo of the constraints in effect, keyed by their request parameter names.
     */
    public Map<String, Object> describe() {
        Map<String, Object> applied = new LinkedHashMap<>();
        if (search != null && !search.isBlank()) {
            applied.put("search", search);
        }
        if (priority != null) {
            applied.put("priority", priority.value());
        }
        if (priorities != null && !priorities.isEmpty()) {
            applied.put("priorities", priorities.stream().map(Task.Priority::value).toList());
        }
        if (isCompleted != null) {
            applied.put("is_completed", isCompleted);
        }
        if (tagId != null) {
            applied.put("tag_id", tagId);
        }
        if (withoutProject) {
            applied.put("project_id", "null");
        } else if (projectId != null) {
            applied.put("project_id", projectId);
        }
        if (dueOn != null) {
            applied.put("due_date", dueOn.toString());
        }
        if (dueFrom != null) {
            applied.put("due_date_from", dueFrom.toString());
        }
        if (dueTo != null) {
            applied.put("due_date_to", dueTo.toString());
        }
        return applied;
    }
}

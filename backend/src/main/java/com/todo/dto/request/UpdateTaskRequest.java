package com.todo.dto.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Partial task update. Keys absent from the body leave the task unchanged;
 * {@code "project_id": null}, {@code "due_date": null} and
 * {@code "description": null} clear the value. {@code tag_ids}, when present,
 * replaces the whole tag set.
 */
@Getter
@NoArgsConstructor
public class UpdateTaskRequest extends PartialUpdateRequest {

    @Size(min = 1, max = 255, message = "{validation.title.between}")
    private String title;

    private String description;

    @Pattern(regexp = "low|medium|high", message = "{validation.priority.invalid}")
    private String priority;

    private LocalDateTime dueDate;

    private Boolean isCompleted;

    private UUID projectId;

    private List<UUID> tagIds;

    public void setTitle(String title) {
        this.title = title;
        markPresent("title");
    }

    public void setDescription(String description) {
        this.description = description;
        markPresent("description");
    }

    public void setPriority(String priority) {
        this.priority = priority;
        markPresent("priority");
    }

    public void setDueDate(LocalDateTime dueDate) {
        this.dueDate = dueDate;
        markPresent("dueDate");
    }

    public void setIsCompleted(Boolean isCompleted) {
        this.isCompleted = isCompleted;
        markPresent("isCompleted");
    }

    public void setProjectId(UUID projectId) {
        this.projectId = projectId;
        markPresent("projectId");
    }

    public void setTagIds(List<UUID> tagIds) {
        this.tagIds = tagIds;
        markPresent("tagIds");
    }
}

package com.todo.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for creating a task.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "title": "Write quarterly report",
 *   "description": "Numbers from finance first",
 *   "priority": "high",
 *   "due_date": "2024-03-01T17:00:00",
 *   "project_id": "550e8400-e29b-41d4-a716-446655440000",
 *   "tag_ids": ["6ba7b810-9dad-11d1-80b4-00c04fd430c8"]
 * }
 * </pre>
 *
 * The project and every tag must belong to the caller; that is checked by the service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    @NotBlank(message = "{validation.title.required}")
    @Size(max = 255, message = "{validation.title.max}")
    private String title;

    private String description;

    @Pattern(regexp = "low|medium|high", message = "{validation.priority.invalid}")
    private String priority;

    private LocalDateTime dueDate;

    private Boolean isCompleted;

    private UUID projectId;

    @Builder.Default
    private List<UUID> tagIds = new ArrayList<>();
}

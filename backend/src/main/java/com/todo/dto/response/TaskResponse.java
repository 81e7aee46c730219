package com.todo.dto.response;

import com.todo.entity.Project;
import com.todo.entity.Tag;
import com.todo.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * A task with its project, tags and subtasks, plus the values derived on read
 * ({@code is_overdue}, {@code subtask_progress}, {@code all_subtasks_completed}).
 *
 * Must be built while the task's associations can still be loaded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private UUID id;

    private String title;

    private String description;

    private String priority;

    private String priorityLabel;

    private LocalDateTime dueDate;

    private Boolean isCompleted;

    private LocalDateTime completedAt;

    private Boolean isOverdue;

    private Integer subtaskProgress;

    private Boolean allSubtasksCompleted;

    private UUID projectId;

    private ProjectRef project;

    private List<TagRef> tags;

    private List<SubtaskResponse> subtasks;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProjectRef {

        private UUID id;

        private String name;

        private String color;

        private String icon;

        static ProjectRef from(Project project) {
            return new ProjectRef(project.getId(), project.getName(), project.getColor(), project.getIcon());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TagRef {

        private UUID id;

        private String name;

        private String color;

        static TagRef from(Tag tag) {
            return new TagRef(tag.getId(), tag.getName(), tag.getColor());
        }
    }

    public static TaskResponse from(Task task) {
        return from(task, LocalDateTime.now());
    }

    public static TaskResponse from(Task task, LocalDateTime now) {
        Project project = task.getProject();
        return TaskResponse.builder()
                .id(task.getId())
                .title(task.getTitle())
                .description(task.getDescription())
                .priority(task.getPriority().value())
                .priorityLabel(task.getPriority().getLabel())
                .dueDate(task.getDueDate())
                .isCompleted(task.getIsCompleted())
                .completedAt(task.getCompletedAt())
                .isOverdue(task.isOverdueAt(now))
                .subtaskProgress(task.getSubtaskProgress())
                .allSubtasksCompleted(task.isAllSubtasksCompleted())
                .projectId(project != null ? project.getId() : null)
                .project(project != null ? ProjectRef.from(project) : null)
                .tags(task.getTags().stream()
                        .sorted(Comparator.comparing(Tag::getName, String.CASE_INSENSITIVE_ORDER))
                        .map(TagRef::from)
                        .toList())
                .subtasks(task.getSubtasks().stream().map(SubtaskResponse::from).toList())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .build();
    }
}

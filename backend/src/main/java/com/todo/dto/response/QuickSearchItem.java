package com.todo.dto.response;

import com.todo.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Compact task row for the command palette.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuickSearchItem {

    private UUID id;

    private String title;

    private String priority;

    private LocalDateTime dueDate;

    private Boolean isCompleted;

    private String projectName;

    public static QuickSearchItem from(Task task) {
        return QuickSearchItem.builder()
                .id(task.getId())
                .title(task.getTitle())
                .priority(task.getPriority().value())
                .dueDate(task.getDueDate())
                .isCompleted(task.getIsCompleted())
                .projectName(task.getProject() != null ? task.getProject().getName() : null)
                .build();
    }
}

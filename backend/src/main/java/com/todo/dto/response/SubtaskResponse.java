package com.todo.dto.response;

import com.todo.entity.Subtask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubtaskResponse {

    private UUID id;

    private UUID taskId;

    private String title;

    private String description;

    private Boolean isCompleted;

    private Integer position;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static SubtaskResponse from(Subtask subtask) {
        return SubtaskResponse.builder()
                .id(subtask.getId())
                .taskId(subtask.getTask().getId())
                .title(subtask.getTitle())
                .description(subtask.getDescription())
                .isCompleted(subtask.getIsCompleted())
                .position(subtask.getPosition())
                .createdAt(subtask.getCreatedAt())
                .updatedAt(subtask.getUpdatedAt())
                .build();
    }
}

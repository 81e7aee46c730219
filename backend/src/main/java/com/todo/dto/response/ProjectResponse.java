package com.todo.dto.response;

import com.todo.entity.Project;
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
public class ProjectResponse {

    private UUID id;

    private String name;

    private String color;

    private String icon;

    private Boolean isFavorite;

    private UUID parentId;

    /**
     * Incomplete tasks in the project.
     */
    private Long taskCount;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static ProjectResponse from(Project project, long taskCount) {
        return ProjectResponse.builder()
                .id(project.getId())
                .name(project.getName())
                .color(project.getColor())
                .icon(project.getIcon())
                .isFavorite(project.getIsFavorite())
                .parentId(project.getParent() != null ? project.getParent().getId() : null)
                .taskCount(taskCount)
                .createdAt(project.getCreatedAt())
                .updatedAt(project.getUpdatedAt())
                .build();
    }
}

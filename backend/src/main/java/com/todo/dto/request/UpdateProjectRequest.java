package com.todo.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Partial project update; {@code "parent_id": null} moves the project to the top level.
 */
@Getter
@NoArgsConstructor
public class UpdateProjectRequest extends PartialUpdateRequest {

    @Size(min = 1, max = 255, message = "{validation.name.between}")
    private String name;

    @Size(max = 20, message = "{validation.color.max}")
    private String color;

    @Size(max = 50, message = "{validation.icon.max}")
    private String icon;

    private Boolean isFavorite;

    private UUID parentId;

    public void setName(String name) {
        this.name = name;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    public void setIsFavorite(Boolean isFavorite) {
        this.isFavorite = isFavorite;
    }

    public void setParentId(UUID parentId) {
        this.parentId = parentId;
        markPresent("parentId");
    }
}

package com.todo.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProjectRequest {

    @NotBlank(message = "{validation.name.required}")
    @Size(max = 255, message = "{validation.name.max}")
    private String name;

    @Size(max = 20, message = "{validation.color.max}")
    private String color;

    @Size(max = 50, message = "{validation.icon.max}")
    private String icon;

    private Boolean isFavorite;

    private UUID parentId;
}

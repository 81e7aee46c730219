package com.todo.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSubtaskRequest {

    @Size(min = 1, max = 255, message = "{validation.title.between}")
    private String title;

    private String description;

    private Boolean isCompleted;

    @Min(value = 0, message = "{validation.position.min}")
    private Integer position;
}

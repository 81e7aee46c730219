package com.todo.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * When {@code position} is omitted the subtask is appended after the last one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateSubtaskRequest {

    @NotBlank(message = "{validation.title.required}")
    @Size(max = 255, message = "{validation.title.max}")
    private String title;

    private String description;

    @Min(value = 0, message = "{validation.position.min}")
    private Integer position;
}

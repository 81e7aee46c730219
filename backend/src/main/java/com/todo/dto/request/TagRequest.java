package com.todo.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create or update a tag. Color, when given, is a {@code #RRGGBB} hex value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagRequest {

    @NotBlank(message = "{validation.name.required}")
    @Size(max = 255, message = "{validation.name.max}")
    private String name;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "{validation.color.hex}")
    private String color;
}

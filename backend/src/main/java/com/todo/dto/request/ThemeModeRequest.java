package com.todo.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThemeModeRequest {

    @NotBlank(message = "{validation.theme_mode.required}")
    @Pattern(regexp = "light|dark|system", message = "{validation.theme_mode.invalid}")
    private String themeMode;
}

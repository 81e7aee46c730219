package com.todo.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial theme update: any of mode, locale and accessibility flags.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThemeUpdateRequest {

    @Pattern(regexp = "light|dark|system", message = "{validation.theme_mode.invalid}")
    private String themeMode;

    @Pattern(regexp = "en|fa", message = "{validation.locale.invalid}")
    private String locale;

    @Valid
    private AccessibilityRequest preferences;
}

package com.todo.dto.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial saved view update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSavedViewRequest {

    @Size(min = 1, max = 255, message = "{validation.name.between}")
    private String name;

    private Map<String, Object> filterConditions;

    private Map<String, Object> sortOrder;

    @Pattern(regexp = "list|calendar|board", message = "{validation.display_mode.invalid}")
    private String displayMode;

    @Size(max = 50, message = "{validation.icon.max}")
    private String icon;

    private Boolean isDefault;
}

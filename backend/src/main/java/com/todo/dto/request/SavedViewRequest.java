package com.todo.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating a saved view.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "name": "Urgent work",
 *   "filter_conditions": { "priority": "high", "is_completed": false },
 *   "sort_order": { "field": "due_date", "direction": "asc" },
 *   "display_mode": "list",
 *   "is_default": true
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedViewRequest {

    @NotBlank(message = "{validation.name.required}")
    @Size(max = 255, message = "{validation.name.max}")
    private String name;

    private Map<String, Object> filterConditions;

    private Map<String, Object> sortOrder;

    @Pattern(regexp = "list|calendar|board", message = "{validation.display_mode.invalid}")
    private String displayMode;

    @Size(max = 50, message = "{validation.icon.max}")
    private String icon;

    private Boolean isDefault;
}

package com.todo.dto.response;

import com.todo.entity.SavedView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedViewResponse {

    private UUID id;

    private String name;

    private Map<String, Object> filters;

    private Map<String, Object> sortOrder;

    private String displayMode;

    private String icon;

    private Boolean isDefault;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static SavedViewResponse from(SavedView view) {
        return SavedViewResponse.builder()
                .id(view.getId())
                .name(view.getName())
                .filters(view.getFilters())
                .sortOrder(view.getSortOrder())
                .displayMode(view.getDisplayMode().value())
                .icon(view.getIcon())
                .isDefault(view.getIsDefault())
                .createdAt(view.getCreatedAt())
                .updatedAt(view.getUpdatedAt())
                .build();
    }
}

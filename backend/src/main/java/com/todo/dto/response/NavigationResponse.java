package com.todo.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything the sidebar renders in one request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigationResponse {

    private List<SystemFilter> systemFilters;

    private List<ProjectResponse> projects;

    private List<ProjectResponse> favorites;

    private List<TagResponse> tags;

    private List<SavedViewResponse> savedViews;

    private NavigationCounts counts;

    /**
     * A built-in listing such as "Inbox" or "Overdue". {@code filter} holds the
     * task-list query parameters that reproduce it.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SystemFilter {

        private String id;

        private String name;

        private String icon;

        private Map<String, Object> filter;

        private long count;
    }
}

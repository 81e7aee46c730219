package com.todo.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything an account owns, for download.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataExportResponse {

    private UserResponse user;

    private PreferenceResponse preferences;

    private List<TaskResponse> tasks;

    private List<ProjectResponse> projects;

    private List<TagResponse> tags;

    private List<SavedViewResponse> savedViews;

    private LocalDateTime exportedAt;
}

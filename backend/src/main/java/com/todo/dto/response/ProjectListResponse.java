package com.todo.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Projects split into favorites and the rest, each ordered by name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProjectListResponse {

    private List<ProjectResponse> favorites;

    private List<ProjectResponse> other;
}

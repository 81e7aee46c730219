package com.todo.dto.request;

import com.todo.service.TaskQueryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.web.bind.annotation.BindParam;

import java.util.UUID;

/**
 * Autocomplete query: search text, result limit (1..20) and an optional project.
 */
@Getter
@ToString
public class QuickSearchQuery {

    @Size(max = TaskListParams.MAX_QUERY_LENGTH, message = "{validation.q.max}")
    private final String q;

    @Min(value = 1, message = "{validation.limit.quick_between}")
    @Max(value = TaskQueryService.MAX_QUICK_LIMIT, message = "{validation.limit.quick_between}")
    private final Integer limit;

    private final UUID projectId;

    @Builder
    public QuickSearchQuery(String q, Integer limit, @BindParam("project_id") UUID projectId) {
        this.q = q;
        this.limit = limit;
        this.projectId = projectId;
    }
}

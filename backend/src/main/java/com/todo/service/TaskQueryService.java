package com.todo.service;

import com.todo.dto.request.CalendarParams;
import com.todo.dto.request.QuickSearchQuery;
import com.todo.dto.request.TaskListParams;
import com.todo.dto.response.CalendarResponse;
import com.todo.dto.response.PageMeta;
import com.todo.dto.response.PagedResponse;
import com.todo.dto.response.QuickSearchItem;
import com.todo.dto.response.QuickSearchResponse;
import com.todo.dto.response.SuggestionsResponse;
import com.todo.dto.response.TaskResponse;
import com.todo.entity.Task;
import com.todo.exception.ValidationException;
import com.todo.repository.TaskFilter;
import com.todo.repository.TaskRepository;
import com.todo.repository.TaskSort;
import com.todo.repository.TaskSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of tasks: filtered listings, full-text search, autocomplete and
 * the calendar range query.
 *
 * Ordering is contributed by the specifications in {@link TaskSpecifications},
 * so every query here runs with an unsorted {@link PageRequest}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TaskQueryService {

    public static final int DEFAULT_QUICK_LIMIT = 10;
    public static final int MAX_QUICK_LIMIT = 20;
    public static final int SUGGESTION_LIMIT = 5;

    private final TaskRepository taskRepository;

    public PagedResponse<TaskResponse> list(UUID userId, TaskListParams params) {
        Page<Task> page = findPage(userId, params.getFilter(), params.getSortBy(), params.isAscending(),
                params.getPage(), params.getPerPage());
        log.debug("Task list for user {}: {} of {} tasks", userId, page.getNumberOfElements(), page.getTotalElements());
        return toPagedResponse(page);
    }

    /**
     * Search by text with relevance ordering by default. The response meta
     * echoes the query and the filters that were applied besides it.
     */
    public PagedResponse<TaskResponse> search(UUID userId, TaskListParams params) {
        Page<Task> page = findPage(userId, params.getFilter(), params.getSortBy(), params.isAscending(),
                params.getPage(), params.getPerPage());

        Map<String, Object> applied = params.getFilter().describe();
        applied.remove("search");

        PagedResponse<TaskResponse> response = toPagedResponse(page);
        PageMeta meta = response.getMeta();
        meta.setQuery(params.getQuery());
        meta.setFiltersApplied(applied);

        log.info("Search '{}' by user {} matched {} tasks", params.getQuery(), userId, page.getTotalElements());
        return response;
    }

    /**
     * Top matches for an autocomplete dropdown, ordered by relevance. A missing
     * limit means {@value #DEFAULT_QUICK_LIMIT}.
     */
    public QuickSearchResponse quickSearch(UUID userId, QuickSearchQuery query) {
        String text = requireQuery(query.getQ());
        int size = query.getLimit() == null ? DEFAULT_QUICK_LIMIT : query.getLimit();

        TaskFilter filter = TaskFilter.builder().search(text).projectId(query.getProjectId()).build();
        Specification<Task> spec = TaskSpecifications.matching(userId, filter)
                .and(TaskSpecifications.orderedByRelevance(text, false));
        List<QuickSearchItem> items = taskRepository.findAll(spec, PageRequest.of(0, size)).getContent().stream()
                .map(QuickSearchItem::from)
                .toList();

        return new QuickSearchResponse(items, new QuickSearchResponse.Meta(text, size, items.size()));
    }

    public SuggestionsResponse suggestions(UUID userId, String query) {
        String text = requireQuery(query);
        List<String> titles = taskRepository.findTitleSuggestions(
                userId, TaskSpecifications.containsPattern(text), PageRequest.of(0, SUGGESTION_LIMIT));
        return new SuggestionsResponse(titles);
    }

    /**
     * Tasks due within the inclusive day range, earliest first.
     */
    public CalendarResponse calendar(UUID userId, CalendarParams params) {
        params.requireOrderedRange();
        TaskFilter filter = TaskFilter.builder()
                .dueFrom(params.getStartDate())
                .dueTo(params.getEndDate())
                .priorities(params.getPriorities())
                .isCompleted(params.isIncludeCompleted() ? null : Boolean.FALSE)
                .build();
        Specification<Task> spec = TaskSpecifications.matching(userId, filter)
                .and(TaskSpecifications.orderedBy(TaskSort.DUE_DATE, true));

        LocalDateTime now = LocalDateTime.now();
        List<TaskResponse> tasks = taskRepository.findAll(spec).stream()
                .map(task -> TaskResponse.from(task, now))
                .toList();

        log.debug("Calendar {}..{} for user {}: {} tasks", params.getStartDate(), params.getEndDate(), userId, tasks.size());
        return new CalendarResponse(tasks,
                new CalendarResponse.Meta(params.getStartDate(), params.getEndDate(), tasks.size()));
    }

    /**
     * One page of the user's tasks matching the filter, in the requested order.
     *
     * @param pageNumber 1-based page number
     */
    public Page<Task> findPage(UUID userId, TaskFilter filter, TaskSort sort, boolean ascending,
                               int pageNumber, int perPage) {
        Specification<Task> spec = TaskSpecifications.matching(userId, filter);
        if (sort == TaskSort.RELEVANCE && filter != null && filter.getSearch() != null) {
            spec = spec.and(TaskSpecifications.orderedByRelevance(filter.getSearch(), ascending));
        } else {
            spec = spec.and(TaskSpecifications.orderedBy(sort == null ? TaskSort.CREATED_AT : sort, ascending));
        }
        return taskRepository.findAll(spec, PageRequest.of(pageNumber - 1, perPage));
    }

    public PagedResponse<TaskResponse> toPagedResponse(Page<Task> page) {
        LocalDateTime now = LocalDateTime.now();
        return PagedResponse.of(page, task -> TaskResponse.from(task, now));
    }

    private String requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw ValidationException.of("q", "validation.q.required");
        }
        String text = query.trim();
        if (text.length() > TaskListParams.MAX_QUERY_LENGTH) {
            throw ValidationException.of("q", "validation.q.max");
        }
        return text;
    }
}

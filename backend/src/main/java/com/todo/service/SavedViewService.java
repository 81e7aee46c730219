package com.todo.service;

import com.todo.dto.request.SavedViewRequest;
import com.todo.dto.request.TaskListParams;
import com.todo.dto.request.UpdateSavedViewRequest;
import com.todo.dto.response.PagedResponse;
import com.todo.dto.response.SavedViewResponse;
import com.todo.dto.response.TaskResponse;
import com.todo.entity.SavedView;
import com.todo.entity.Task;
import com.todo.entity.User;
import com.todo.exception.ResourceNotFoundException;
import com.todo.exception.UnauthorizedException;
import com.todo.exception.ValidationException;
import com.todo.repository.SavedViewRepository;
import com.todo.repository.TaskFilter;
import com.todo.repository.TaskSort;
import com.todo.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Service for saved views: named task filters with a sort order and display mode.
 *
 * Filters are stored as the client sent them and interpreted only when the
 * view's tasks are read. Recognised keys:
 * <ul>
 *   <li>{@code search}: text matched against title and description</li>
 *   <li>{@code priority}: low, medium or high</li>
 *   <li>{@code is_completed}: boolean</li>
 *   <li>{@code tag_id}, {@code project_id}: ids</li>
 *   <li>{@code due_date}: {@code {from, to}} days, both inclusive and optional</li>
 * </ul>
 * Unknown keys and unreadable values are ignored.
 *
 * The sort order is {@code {field, direction}}, checked on write. Direction
 * defaults to ascending when a field is given.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SavedViewService {

    private final SavedViewRepository savedViewRepository;
    private final UserRepository userRepository;
    private final TaskQueryService taskQueryService;

    @Transactional(readOnly = true)
    public List<SavedViewResponse> list(UUID userId) {
        return savedViewRepository.findByUserIdOrderByNameAsc(userId).stream()
                .map(SavedViewResponse::from)
                .toList();
    }

    @Transactional
    public SavedViewResponse create(UUID userId, SavedViewRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));

        SavedView view = new SavedView(user, request.getName().trim());
        view.setFilters(request.getFilterConditions() != null
                ? new HashMap<>(request.getFilterConditions()) : new HashMap<>());
        view.setSortOrder(checkSortOrder(request.getSortOrder()));
        if (request.getDisplayMode() != null) {
            view.setDisplayMode(SavedView.DisplayMode.fromValue(request.getDisplayMode()));
        }
        if (request.getIcon() != null) {
            view.setIcon(request.getIcon());
        }
        view.setIsDefault(Boolean.TRUE.equals(request.getIsDefault()));

        view = savedViewRepository.save(view);
        if (Boolean.TRUE.equals(view.getIsDefault())) {
            savedViewRepository.clearDefaultExcept(userId, view.getId());
        }

        log.info("Saved view created: {} ({}) for user {}", view.getId(), view.getName(), userId);
        return SavedViewResponse.from(view);
    }

    @Transactional(readOnly = true)
    public SavedViewResponse show(UUID userId, UUID viewId) {
        return SavedViewResponse.from(getOwnedView(userId, viewId));
    }

    @Transactional
    public SavedViewResponse update(UUID userId, UUID viewId, UpdateSavedViewRequest request) {
        SavedView view = getOwnedView(userId, viewId);

        if (request.getName() != null) {
            view.setName(request.getName().trim());
        }
        if (request.getFilterConditions() != null) {
            view.setFilters(new HashMap<>(request.getFilterConditions()));
        }
        if (request.getSortOrder() != null) {
            view.setSortOrder(checkSortOrder(request.getSortOrder()));
        }
        if (request.getDisplayMode() != null) {
            view.setDisplayMode(SavedView.DisplayMode.fromValue(request.getDisplayMode()));
        }
        if (request.getIcon() != null) {
            view.setIcon(request.getIcon());
        }
        if (request.getIsDefault() != null) {
            view.setIsDefault(request.getIsDefault());
        }

        view = savedViewRepository.save(view);
        if (Boolean.TRUE.equals(view.getIsDefault())) {
            savedViewRepository.clearDefaultExcept(userId, view.getId());
        }

        log.info("Saved view updated: {} for user {}", viewId, userId);
        return SavedViewResponse.from(view);
    }

    @Transactional
    public void delete(UUID userId, UUID viewId) {
        SavedView view = getOwnedView(userId, viewId);
        savedViewRepository.delete(view);
        log.info("Saved view deleted: {} for user {}", viewId, userId);
    }

    /**
     * The view's tasks, with its filters and sort applied now.
     *
     * @param page 1-based page
     * @param perPage 1..100
     */
    @Transactional(readOnly = true)
    public PagedResponse<TaskResponse> tasks(UUID userId, UUID viewId, int page, int perPage) {
        if (page < 1) {
            throw ValidationException.of("page", "validation.page.min");
        }
        if (perPage < 1 || perPage > TaskListParams.MAX_PER_PAGE) {
            throw ValidationException.of("per_page", "validation.per_page.between");
        }

        SavedView view = getOwnedView(userId, viewId);
        TaskFilter filter = toTaskFilter(view.getFilters());

        TaskSort sort = TaskSort.CREATED_AT;
        boolean ascending = false;
        Map<String, Object> sortOrder = view.getSortOrder();
        if (sortOrder != null && sortOrder.get("field") != null) {
            TaskSort stored = TaskSort.fromKey(String.valueOf(sortOrder.get("field")));
            if (stored != null && stored != TaskSort.RELEVANCE) {
                sort = stored;
                ascending = !"desc".equalsIgnoreCase(String.valueOf(sortOrder.get("direction")));
            }
        }

        Page<Task> tasks = taskQueryService.findPage(userId, filter, sort, ascending, page, perPage);
        return taskQueryService.toPagedResponse(tasks);
    }

    public SavedView getOwnedView(UUID userId, UUID viewId) {
        SavedView view = savedViewRepository.findById(viewId)
                .orElseThrow(() -> ResourceNotFoundException.of("SavedView", viewId));
        if (!view.isOwnedBy(userId)) {
            log.warn("User {} attempted to access saved view {} owned by another user", userId, viewId);
            throw UnauthorizedException.accessDenied("saved view", viewId);
        }
        return view;
    }

    /**
     * Interprets stored filter conditions. Values that cannot be read are skipped.
     */
    static TaskFilter toTaskFilter(Map<String, Object> conditions) {
        TaskFilter filter = new TaskFilter();
        if (conditions == null) {
            return filter;
        }

        Object search = conditions.get("search");
        if (search instanceof String && !((String) search).isBlank()) {
            filter.setSearch(((String) search).trim());
        }

        Object priority = conditions.get("priority");
        if (priority instanceof String) {
            try {
                filter.setPriority(Task.Priority.fromValue((String) priority));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unknown saved view priority: {}", priority);
            }
        }

        Object completed = conditions.get("is_completed");
        if (completed instanceof Boolean) {
            filter.setIsCompleted((Boolean) completed);
        } else if (completed != null) {
            String text = String.valueOf(completed).toLowerCase(Locale.ROOT);
            if ("true".equals(text) || "1".equals(text)) {
                filter.setIsCompleted(true);
            } else if ("false".equals(text) || "0".equals(text)) {
                filter.setIsCompleted(false);
            }
        }

        filter.setTagId(toUuid(conditions.get("tag_id")));

        Object project = conditions.get("project_id");
        if ("null".equals(project)) {
            filter.setWithoutProject(true);
        } else {
            filter.setProjectId(toUuid(project));
        }

        Object dueDate = conditions.get("due_date");
        if (dueDate instanceof Map) {
            Map<?, ?> range = (Map<?, ?>) dueDate;
            filter.setDueFrom(toDay(range.get("from")));
            filter.setDueTo(toDay(range.get("to")));
        }
        return filter;
    }

    /**
     * @return a normalized copy, or null when no sort order was given
     * @throws ValidationException if the field or direction is not recognised
     */
    static Map<String, Object> checkSortOrder(Map<String, Object> sortOrder) {
        if (sortOrder == null || sortOrder.isEmpty()) {
            return null;
        }
        Object field = sortOrder.get("field");
        TaskSort sort = field == null ? null : TaskSort.fromKey(String.valueOf(field));
        if (sort == null || sort == TaskSort.RELEVANCE) {
            throw ValidationException.of("sort_order.field", "validation.sort_order_field.invalid");
        }
        String direction = sortOrder.get("direction") == null
                ? "asc" : String.valueOf(sortOrder.get("direction")).toLowerCase(Locale.ROOT);
        if (!"asc".equals(direction) && !"desc".equals(direction)) {
            throw ValidationException.of("sort_order.direction", "validation.sort_order_direction.invalid");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("field", sort.getKey());
        normalized.put("direction", direction);
        return normalized;
    }

    private static UUID toUuid(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(String.valueOf(value));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unreadable saved view id: {}", value);
            return null;
        }
    }

    private static LocalDate toDay(Object value) {
        if (value == null || String.valueOf(value).isBlank()) {
            return null;
        }
        String text = String.valueOf(value).trim();
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unreadable saved view date: {}", value);
            return null;
        }
    }
}

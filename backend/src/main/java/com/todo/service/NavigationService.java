package com.todo.service;

import com.todo.dto.response.NavigationCounts;
import com.todo.dto.response.NavigationResponse;
import com.todo.dto.response.NavigationResponse.SystemFilter;
import com.todo.dto.response.ProjectResponse;
import com.todo.repository.ProjectRepository;
import com.todo.repository.SavedViewRepository;
import com.todo.repository.TagRepository;
import com.todo.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sidebar data: the built-in task filters with their counts, projects, tags and
 * saved views.
 *
 * "Today" is the server's calendar day. Overdue and upcoming are relative to
 * that day, not to the current instant, so a task due later today is neither.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NavigationService {

    private final TaskRepository taskRepository;
    private final ProjectRepository projectRepository;
    private final TagRepository tagRepository;
    private final SavedViewRepository savedViewRepository;
    private final ProjectService projectService;
    private final TagService tagService;
    private final SavedViewService savedViewService;

    public NavigationResponse navigation(UUID userId) {
        LocalDate today = LocalDate.now();
        NavigationCounts counts = counts(userId, today);

        List<ProjectResponse> projects = projectService.listFavoritesFirst(userId);
        List<ProjectResponse> favorites = projects.stream()
                .filter(p -> Boolean.TRUE.equals(p.getIsFavorite()))
                .toList();

        return NavigationResponse.builder()
                .systemFilters(systemFilters(counts, today))
                .projects(projects)
                .favorites(favorites)
                .tags(tagService.list(userId))
                .savedViews(savedViewService.list(userId))
                .counts(counts)
                .build();
    }

    public NavigationCounts counts(UUID userId) {
        return counts(userId, LocalDate.now());
    }

    NavigationCounts counts(UUID userId, LocalDate today) {
        LocalDateTime startOfToday = today.atStartOfDay();
        LocalDateTime startOfTomorrow = today.plusDays(1).atStartOfDay();

        return NavigationCounts.builder()
                .inbox(taskRepository.countByUserIdAndProjectIsNullAndIsCompletedFalse(userId))
                .allTasks(taskRepository.countByUserId(userId))
                .completed(taskRepository.countByUserIdAndIsCompleted(userId, true))
                .today(taskRepository.countIncompleteDueBetween(userId, startOfToday, startOfTomorrow))
                .overdue(taskRepository.countIncompleteDueBefore(userId, startOfToday))
                .upcoming(taskRepository.countIncompleteDueFrom(userId, startOfTomorrow))
                .projects(projectRepository.countByUserId(userId))
                .tags(tagRepository.countByUserId(userId))
                .savedViews(savedViewRepository.countByUserId(userId))
                .build();
    }

    /**
     * Each filter carries the task-list query parameters that reproduce it.
     */
    static List<SystemFilter> systemFilters(NavigationCounts counts, LocalDate today) {
        return List.of(
                new SystemFilter("inbox", "Inbox", "inbox",
                        filter("project_id", "null", "status", "pending"), counts.getInbox()),
                new SystemFilter("all_tasks", "All Tasks", "format_list_bulleted",
                        filter(), counts.getAllTasks()),
                new SystemFilter("completed", "Completed", "check_circle",
                        filter("status", "completed"), counts.getCompleted()),
                new SystemFilter("today", "Today", "today",
                        filter("due_date", today.toString(), "status", "pending"), counts.getToday()),
                new SystemFilter("overdue", "Overdue", "schedule",
                        filter("due_date_to", today.minusDays(1).toString(), "status", "pending"), counts.getOverdue()),
                new SystemFilter("upcoming", "Upcoming", "date_range",
                        filter("due_date_from", today.plusDays(1).toString(), "status", "pending"), counts.getUpcoming())
        );
    }

    private static Map<String, Object> filter(String... keyValues) {
        Map<String, Object> filter = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            filter.put(keyValues[i], keyValues[i + 1]);
        }
        return filter;
    }
}

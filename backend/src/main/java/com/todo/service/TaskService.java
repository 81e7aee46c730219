package com.todo.service;

import com.todo.dto.request.CreateTaskRequest;
import com.todo.dto.request.TaskDateRequest;
import com.todo.dto.request.UpdateTaskRequest;
import com.todo.dto.response.OptionItem;
import com.todo.dto.response.TaskOptionsResponse;
import com.todo.dto.response.TaskResponse;
import com.todo.entity.Project;
import com.todo.entity.Tag;
import com.todo.entity.Task;
import com.todo.entity.User;
import com.todo.exception.ResourceNotFoundException;
import com.todo.exception.UnauthorizedException;
import com.todo.exception.ValidationException;
import com.todo.repository.NotificationLogRepository;
import com.todo.repository.NotificationRuleRepository;
import com.todo.repository.ProjectRepository;
import com.todo.repository.TagRepository;
import com.todo.repository.TaskRepository;
import com.todo.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Service for single-task operations.
 *
 * Every operation by id loads the task first and then checks its owner, so an
 * unknown id is reported as not found and a foreign id as access denied.
 * Listings and search live in {@link TaskQueryService}.
 *
 * Completion is always applied through {@link Task#setCompletion(boolean)} so
 * that {@code completed_at} follows {@code is_completed}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TaskService {

    static final String TASK_DELETED_REASON = "Task deleted or notification cancelled";

    private final TaskRepository taskRepository;
    private final ProjectRepository projectRepository;
    private final TagRepository tagRepository;
    private final UserRepository userRepository;
    private final NotificationRuleRepository ruleRepository;
    private final NotificationLogRepository logRepository;

    @Transactional
    public TaskResponse create(UUID userId, CreateTaskRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));

        Task task = new Task(user, request.getTitle().trim());
        task.setDescription(request.getDescription());
        if (request.getPriority() != null) {
            task.setPriority(Task.Priority.fromValue(request.getPriority()));
        }
        task.setDueDate(request.getDueDate());
        if (request.getIsCompleted() != null) {
            task.setCompletion(request.getIsCompleted());
        }
        if (request.getProjectId() != null) {
            task.setProject(resolveProject(userId, request.getProjectId()));
        }
        if (request.getTagIds() != null && !request.getTagIds().isEmpty()) {
            task.replaceTags(resolveTags(userId, request.getTagIds()));
        }

        task = taskRepository.save(task);
        log.info("Task created: {} for user {}", task.getId(), userId);
        return TaskResponse.from(task);
    }

    @Transactional(readOnly = true)
    public TaskResponse show(UUID userId, UUID taskId) {
        return TaskResponse.from(getOwnedTask(userId, taskId));
    }

    /**
     * Applies only the fields present in the request. An explicit null clears
     * nullable fields (description, due date, project); tag_ids replaces the
     * whole tag set.
     */
    @Transactional
    public TaskResponse update(UUID userId, UUID taskId, UpdateTaskRequest request) {
        Task task = getOwnedTask(userId, taskId);

        if (request.isPresent("title")) {
            if (request.getTitle() == null || request.getTitle().isBlank()) {
                throw ValidationException.of("title", "validation.title.required");
            }
            task.setTitle(request.getTitle().trim());
        }
        if (request.isPresent("description")) {
            task.setDescription(request.getDescription());
        }
        if (request.isPresent("priority") && request.getPriority() != null) {
            task.setPriority(Task.Priority.fromValue(request.getPriority()));
        }
        if (request.isPresent("dueDate")) {
            task.setDueDate(request.getDueDate());
        }
        if (request.isPresent("isCompleted") && request.getIsCompleted() != null) {
            task.setCompletion(request.getIsCompleted());
        }
        if (request.isPresent("projectId")) {
            task.setProject(request.getProjectId() == null ? null : resolveProject(userId, request.getProjectId()));
        }
        if (request.isPresent("tagIds")) {
            task.replaceTags(request.getTagIds() == null ? Set.of() : resolveTags(userId, request.getTagIds()));
        }

        task = taskRepository.save(task);
        log.info("Task updated: {} for user {}", taskId, userId);
        return TaskResponse.from(task);
    }

    @Transactional
    public TaskResponse updateDate(UUID userId, UUID taskId, TaskDateRequest request) {
        Task task = getOwnedTask(userId, taskId);
        task.setDueDate(request.getDueDate());
        task = taskRepository.save(task);
        log.info("Task {} rescheduled to {}", taskId, request.getDueDate());
        return TaskResponse.from(task);
    }

    /**
     * Mark a task completed or pending.
     */
    @Transactional
    public TaskResponse setCompleted(UUID userId, UUID taskId, boolean completed) {
        Task task = getOwnedTask(userId, taskId);
        task.setCompletion(completed);
        task = taskRepository.save(task);
        log.info("Task {} marked {}", taskId, completed ? "completed" : "pending");
        return TaskResponse.from(task);
    }

    /**
     * Delete a task with its subtasks and reminder rules. Pending deliveries are
     * failed; the log history is kept without the task reference.
     */
    @Transactional
    public void delete(UUID userId, UUID taskId) {
        Task task = getOwnedTask(userId, taskId);

        int failed = logRepository.failPendingByTaskId(taskId, TASK_DELETED_REASON);
        logRepository.detachFromTask(taskId);
        int rules = ruleRepository.deleteByTaskId(taskId);
        task.getTags().clear();
        taskRepository.delete(task);

        log.info("Task deleted: {} for user {} ({} rules removed, {} pending reminders failed)",
                taskId, userId, rules, failed);
    }

    public TaskOptionsResponse options() {
        List<OptionItem> statuses = List.of(
                new OptionItem("pending", "Pending"),
                new OptionItem("completed", "Completed"),
                new OptionItem("all", "All"));
        List<OptionItem> priorities = Arrays.stream(Task.Priority.values())
                .map(p -> new OptionItem(p.value(), p.getLabel()))
                .toList();
        return new TaskOptionsResponse(statuses, priorities);
    }

    /**
     * Load a task and check that the caller owns it.
     *
     * @throws ResourceNotFoundException if no task has the id
     * @throws UnauthorizedException if the task belongs to another user
     */
    public Task getOwnedTask(UUID userId, UUID taskId) {
        Task task = taskRepository.findById(taskId)
                .orElseThrow(() -> ResourceNotFoundException.of("Task", taskId));
        if (!task.isOwnedBy(userId)) {
            log.warn("User {} attempted to access task {} owned by another user", userId, taskId);
            throw UnauthorizedException.accessDenied("task", taskId);
        }
        return task;
    }

    private Project resolveProject(UUID userId, UUID projectId) {
        return projectRepository.findById(projectId)
                .filter(p -> p.isOwnedBy(userId))
                .orElseThrow(() -> ValidationException.of("project_id", "validation.project_id.invalid"));
    }

    private Set<Tag> resolveTags(UUID userId, Collection<UUID> tagIds) {
        Set<UUID> wanted = new LinkedHashSet<>(tagIds);
        List<Tag> found = tagRepository.findByUserIdAndIdIn(userId, wanted);
        if (found.size() != wanted.size()) {
            throw ValidationException.of("tag_ids", "validation.tag_ids.invalid");
        }
        return new LinkedHashSet<>(found);
    }
}

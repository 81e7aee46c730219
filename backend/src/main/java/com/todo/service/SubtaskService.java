package com.todo.service;

import com.todo.dto.request.CreateSubtaskRequest;
import com.todo.dto.request.UpdateSubtaskRequest;
import com.todo.dto.response.SubtaskListResponse;
import com.todo.dto.response.SubtaskResponse;
import com.todo.entity.Subtask;
import com.todo.entity.Task;
import com.todo.exception.ResourceNotFoundException;
import com.todo.repository.SubtaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Checklist items of a task. Every operation first checks that the caller owns
 * the parent task; a subtask that exists under another task is reported as not
 * found.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubtaskService {

    private final SubtaskRepository subtaskRepository;
    private final TaskService taskService;

    @Transactional(readOnly = true)
    public SubtaskListResponse list(UUID userId, UUID taskId) {
        taskService.getOwnedTask(userId, taskId);
        List<SubtaskResponse> subtasks = subtaskRepository.findByTaskIdOrderByPositionAsc(taskId).stream()
                .map(SubtaskResponse::from)
                .toList();
        long completed = subtasks.stream().filter(s -> Boolean.TRUE.equals(s.getIsCompleted())).count();
        return new SubtaskListResponse(subtasks, new SubtaskListResponse.Meta(subtasks.size(), completed));
    }

    /**
     * Appends a subtask. Without an explicit position it goes after the current
     * last one, or at 0 for the first.
     */
    @Transactional
    public SubtaskResponse create(UUID userId, UUID taskId, CreateSubtaskRequest request) {
        Task task = taskService.getOwnedTask(userId, taskId);

        Integer position = request.getPosition();
        if (position == null) {
            Integer max = subtaskRepository.findMaxPosition(taskId);
            position = max == null ? 0 : max + 1;
        }

        Subtask subtask = new Subtask(task, request.getTitle().trim(), position);
        subtask.setDescription(request.getDescription());
        subtask = subtaskRepository.save(subtask);
        task.getSubtasks().add(subtask);

        log.info("Subtask {} added to task {}", subtask.getId(), taskId);
        return SubtaskResponse.from(subtask);
    }

    @Transactional
    public SubtaskResponse update(UUID userId, UUID taskId, UUID subtaskId, UpdateSubtaskRequest request) {
        Subtask subtask = getSubtask(userId, taskId, subtaskId);

        if (request.getTitle() != null) {
            subtask.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            subtask.setDescription(request.getDescription());
        }
        if (request.getIsCompleted() != null) {
            subtask.setIsCompleted(request.getIsCompleted());
        }
        if (request.getPosition() != null) {
            subtask.setPosition(request.getPosition());
        }

        return SubtaskResponse.from(subtaskRepository.save(subtask));
    }

    @Transactional
    public SubtaskResponse toggle(UUID userId, UUID taskId, UUID subtaskId) {
        Subtask subtask = getSubtask(userId, taskId, subtaskId);
        subtask.toggle();
        log.info("Subtask {} toggled to {}", subtaskId, subtask.getIsCompleted());
        return SubtaskResponse.from(subtaskRepository.save(subtask));
    }

    @Transactional
    public void delete(UUID userId, UUID taskId, UUID subtaskId) {
        Subtask subtask = getSubtask(userId, taskId, subtaskId);
        subtask.getTask().getSubtasks().remove(subtask);
        subtaskRepository.delete(subtask);
        log.info("Subtask {} deleted from task {}", subtaskId, taskId);
    }

    private Subtask getSubtask(UUID userId, UUID taskId, UUID subtaskId) {
        taskService.getOwnedTask(userId, taskId);
        return subtaskRepository.findById(subtaskId)
                .filter(s -> s.getTask().getId().equals(taskId))
                .orElseThrow(() -> ResourceNotFoundException.of("Subtask", subtaskId));
    }
}

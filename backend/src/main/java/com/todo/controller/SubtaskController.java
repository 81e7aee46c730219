package com.todo.controller;

import com.todo.dto.request.CreateSubtaskRequest;
import com.todo.dto.request.UpdateSubtaskRequest;
import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.SubtaskListResponse;
import com.todo.dto.response.SubtaskResponse;
import com.todo.security.CurrentUser;
import com.todo.service.SubtaskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Checklist items of a task. The parent task must belong to the caller.
 */
@RestController
@RequestMapping("/api/tasks/{taskId}/subtasks")
@RequiredArgsConstructor
@Slf4j
public class SubtaskController {

    private final SubtaskService subtaskService;
    private final MessageSourceAccessor messages;

    @GetMapping
    public ResponseEntity<SubtaskListResponse> list(
            Authentication authentication,
            @PathVariable UUID taskId) {

        return ResponseEntity.ok(subtaskService.list(CurrentUser.userId(authentication), taskId));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<SubtaskResponse>> create(
            Authentication authentication,
            @PathVariable UUID taskId,
            @Valid @RequestBody CreateSubtaskRequest request) {

        SubtaskResponse subtask = subtaskService.create(CurrentUser.userId(authentication), taskId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(messages.getMessage("subtask.created"), subtask));
    }

    @PutMapping("/{subtaskId}")
    public ResponseEntity<ApiResponse<SubtaskResponse>> update(
            Authentication authentication,
            @PathVariable UUID taskId,
            @PathVariable UUID subtaskId,
            @Valid @RequestBody UpdateSubtaskRequest request) {

        SubtaskResponse subtask = subtaskService.update(CurrentUser.userId(authentication), taskId, subtaskId, request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("subtask.updated"), subtask));
    }

    @PatchMapping("/{subtaskId}/toggle")
    public ResponseEntity<ApiResponse<SubtaskResponse>> toggle(
            Authentication authentication,
            @PathVariable UUID taskId,
            @PathVariable UUID subtaskId) {

        SubtaskResponse subtask = subtaskService.toggle(CurrentUser.userId(authentication), taskId, subtaskId);
        return ResponseEntity.ok(ApiResponse.ok(subtask));
    }

    @DeleteMapping("/{subtaskId}")
    public ResponseEntity<ApiResponse<Void>> delete(
            Authentication authentication,
            @PathVariable UUID taskId,
            @PathVariable UUID subtaskId) {

        log.info("Subtask deletion requested: {} of task {} by user: {}", subtaskId, taskId, authentication.getName());
        subtaskService.delete(CurrentUser.userId(authentication), taskId, subtaskId);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("subtask.deleted")));
    }
}

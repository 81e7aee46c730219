package com.todo.controller;

import com.todo.dto.request.SavedViewRequest;
import com.todo.dto.request.TaskListParams;
import com.todo.dto.request.UpdateSavedViewRequest;
import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.PagedResponse;
import com.todo.dto.response.SavedViewResponse;
import com.todo.dto.response.TaskResponse;
import com.todo.security.CurrentUser;
import com.todo.service.SavedViewService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Named filter and sort combinations. At most one view per user is the
 * default; marking another one clears the flag on the rest.
 */
@RestController
@RequestMapping("/api/saved-views")
@RequiredArgsConstructor
@Slf4j
public class SavedViewController {

    private final SavedViewService savedViewService;
    private final MessageSourceAccessor messages;

    @GetMapping
    public ResponseEntity<ApiResponse<List<SavedViewResponse>>> list(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(savedViewService.list(CurrentUser.userId(authentication))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<SavedViewResponse>> create(
            Authentication authentication,
            @Valid @RequestBody SavedViewRequest request) {

        log.info("Saved view creation requested by user: {}", authentication.getName());
        SavedViewResponse view = savedViewService.create(CurrentUser.userId(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(messages.getMessage("saved_view.created"), view));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SavedViewResponse>> show(
            Authentication authentication,
            @PathVariable UUID id) {

        return ResponseEntity.ok(ApiResponse.ok(savedViewService.show(CurrentUser.userId(authentication), id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApiResponse<SavedViewResponse>> update(
            Authentication authentication,
            @PathVariable UUID id,
            @Valid @RequestBody UpdateSavedViewRequest request) {

        SavedViewResponse view = savedViewService.update(CurrentUser.userId(authentication), id, request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("saved_view.updated"), view));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            Authentication authentication,
            @PathVariable UUID id) {

        savedViewService.delete(CurrentUser.userId(authentication), id);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("saved_view.deleted")));
    }

    /**
     * Tasks matching the stored filters, ordered by the stored sort.
     */
    @GetMapping("/{id}/tasks")
    public ResponseEntity<PagedResponse<TaskResponse>> tasks(
            Authentication authentication,
            @PathVariable UUID id,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "" + TaskListParams.DEFAULT_PER_PAGE) int perPage) {

        return ResponseEntity.ok(savedViewService.tasks(CurrentUser.userId(authentication), id, page, perPage));
    }
}

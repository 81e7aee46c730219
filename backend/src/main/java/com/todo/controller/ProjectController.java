package com.todo.controller;

import com.todo.dto.request.CreateProjectRequest;
import com.todo.dto.request.FavoriteRequest;
import com.todo.dto.request.UpdateProjectRequest;
import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.ProjectListResponse;
import com.todo.dto.response.ProjectResponse;
import com.todo.exception.UnauthorizedException;
import com.todo.security.CurrentUser;
import com.todo.service.ProjectService;
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
 * REST Controller for projects.
 *
 * Projects can nest through parent_id. Deleting a project deletes its whole
 * subtree; tasks of the deleted projects move to the inbox.
 */
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
@Slf4j
public class ProjectController {

    private final ProjectService projectService;
    private final MessageSourceAccessor messages;

    /**
     * Favorites and the remaining projects as two lists, each with its
     * incomplete task count.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<ProjectListResponse>> list(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(projectService.list(CurrentUser.userId(authentication))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ProjectResponse>> create(
            Authentication authentication,
            @Valid @RequestBody CreateProjectRequest request) {

        log.info("Project creation requested by user: {}", authentication.getName());
        ProjectResponse project = projectService.create(CurrentUser.userId(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(messages.getMessage("project.created"), project));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ProjectResponse>> show(
            Authentication authentication,
            @PathVariable UUID id) {

        return ResponseEntity.ok(ApiResponse.ok(projectService.show(CurrentUser.userId(authentication), id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ProjectResponse>> update(
            Authentication authentication,
            @PathVariable UUID id,
            @Valid @RequestBody UpdateProjectRequest request) {

        ProjectResponse project = projectService.update(CurrentUser.userId(authentication), id, request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("project.updated"), project));
    }

    @PatchMapping("/{id}/favorite")
    public ResponseEntity<ApiResponse<ProjectResponse>> favorite(
            Authentication authentication,
            @PathVariable UUID id,
            @Valid @RequestBody FavoriteRequest request) {

        ProjectResponse project = projectService.setFavorite(
                CurrentUser.userId(authentication), id, request.getIsFavorite());
        return ResponseEntity.ok(ApiResponse.ok(project));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            Authentication authentication,
            @PathVariable UUID id) {

        log.info("Project deletion requested: {} by user: {}", id, authentication.getName());

        try {
            projectService.delete(CurrentUser.userId(authentication), id);
            return ResponseEntity.ok(ApiResponse.message(messages.getMessage("project.deleted")));

        } catch (UnauthorizedException e) {
            log.warn("Access denied deleting project: {} by user: {}", id, authentication.getName());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }
}

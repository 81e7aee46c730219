package com.todo.service;

import com.todo.dto.request.CreateProjectRequest;
import com.todo.dto.request.UpdateProjectRequest;
import com.todo.dto.response.ProjectListResponse;
import com.todo.dto.response.ProjectResponse;
import com.todo.entity.Project;
import com.todo.entity.User;
import com.todo.exception.ResourceNotFoundException;
import com.todo.exception.UnauthorizedException;
import com.todo.exception.ValidationException;
import com.todo.repository.ProjectRepository;
import com.todo.repository.TaskRepository;
import com.todo.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for projects and their nesting.
 *
 * Project names are unique per user, compared case-insensitively. A parent must
 * belong to the same user and may not be the project itself or one of its
 * descendants.
 *
 * Deleting a project deletes its whole subtree. Tasks in any deleted project
 * stay in place without a project.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProjectService {

    static final String NAME_TAKEN = "validation.name.unique";

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final UserRepository userRepository;

    /**
     * All projects split into favorites and the rest, each ordered by name and
     * carrying its incomplete task count.
     */
    @Transactional(readOnly = true)
    public ProjectListResponse list(UUID userId) {
        List<ProjectResponse> all = withCounts(userId, projectRepository.findByUserIdOrderByNameAsc(userId));
        List<ProjectResponse> favorites = all.stream().filter(p -> Boolean.TRUE.equals(p.getIsFavorite())).toList();
        List<ProjectResponse> other = all.stream().filter(p -> !Boolean.TRUE.equals(p.getIsFavorite())).toList();
        return new ProjectListResponse(favorites, other);
    }

    /**
     * Projects favorites first, then by name, with incomplete task counts.
     */
    @Transactional(readOnly = true)
    public List<ProjectResponse> listFavoritesFirst(UUID userId) {
        return withCounts(userId, projectRepository.findByUserIdFavoritesFirst(userId));
    }

    @Transactional
    public ProjectResponse create(UUID userId, CreateProjectRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));

        String name = request.getName().trim();
        if (projectRepository.existsByUserIdAndNameIgnoreCase(userId, name)) {
            throw ValidationException.of("name", NAME_TAKEN);
        }

        Project project = new Project(user, name);
        if (request.getColor() != null) {
            project.setColor(request.getColor());
        }
        if (request.getIcon() != null) {
            project.setIcon(request.getIcon());
        }
        if (request.getIsFavorite() != null) {
            project.setIsFavorite(request.getIsFavorite());
        }
        if (request.getParentId() != null) {
            project.setParent(resolveParent(userId, request.getParentId()));
        }

        project = projectRepository.save(project);
        log.info("Project created: {} ({}) for user {}", project.getId(), name, userId);
        return ProjectResponse.from(project, 0);
    }

    @Transactional(readOnly = true)
    public ProjectResponse show(UUID userId, UUID projectId) {
        Project project = getOwnedProject(userId, projectId);
        return ProjectResponse.from(project, incompleteCount(userId, projectId));
    }

    @Transactional
    public ProjectResponse update(UUID userId, UUID projectId, UpdateProjectRequest request) {
        Project project = getOwnedProject(userId, projectId);

        if (request.getName() != null) {
            String name = request.getName().trim();
            if (projectRepository.existsByUserIdAndNameIgnoreCaseAndIdNot(userId, name, projectId)) {
                throw ValidationException.of("name", NAME_TAKEN);
            }
            project.setName(name);
        }
        if (request.getColor() != null) {
            project.setColor(request.getColor());
        }
        if (request.getIcon() != null) {
            project.setIcon(request.getIcon());
        }
        if (request.getIsFavorite() != null) {
            project.setIsFavorite(request.getIsFavorite());
        }
        if (request.isPresent("parentId")) {
            if (request.getParentId() == null) {
                project.setParent(null);
            } else {
                Project parent = resolveParent(userId, request.getParentId());
                if (collectSubtree(project).contains(parent.getId())) {
                    throw ValidationException.of("parent_id", "validation.parent_id.self");
                }
                project.setParent(parent);
            }
        }

        project = projectRepository.save(project);
        log.info("Project updated: {} for user {}", projectId, userId);
        return ProjectResponse.from(project, incompleteCount(userId, projectId));
    }

    @Transactional
    public ProjectResponse setFavorite(UUID userId, UUID projectId, boolean favorite) {
        Project project = getOwnedProject(userId, projectId);
        project.setIsFavorite(favorite);
        project = projectRepository.save(project);
        log.info("Project {} favorite set to {}", projectId, favorite);
        return ProjectResponse.from(project, incompleteCount(userId, projectId));
    }

    /**
     * Delete the project and its descendants, deepest first. Their tasks are
     * kept and moved out of any project.
     */
    @Transactional
    public void delete(UUID userId, UUID projectId) {
        Project project = getOwnedProject(userId, projectId);

        List<UUID> subtree = collectSubtree(project);
        int detached = taskRepository.detachFromProjects(subtree);

        List<UUID> deepestFirst = new ArrayList<>(subtree);
        Collections.reverse(deepestFirst);
        for (UUID id : deepestFirst) {
            projectRepository.deleteById(id);
        }
        projectRepository.flush();

        log.info("Project {} deleted with {} descendants; {} tasks moved out", projectId, subtree.size() - 1, detached);
    }

    public Project getOwnedProject(UUID userId, UUID projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> ResourceNotFoundException.of("Project", projectId));
        if (!project.isOwnedBy(userId)) {
            log.warn("User {} attempted to access project {} owned by another user", userId, projectId);
            throw UnauthorizedException.accessDenied("project", projectId);
        }
        return project;
    }

    /**
     * Ids of the project and all its descendants in breadth-first order, so
     * every parent precedes its children.
     */
    List<UUID> collectSubtree(Project root) {
        List<UUID> ids = new ArrayList<>();
        Deque<Project> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Project current = queue.poll();
            if (ids.contains(current.getId())) {
                continue;
            }
            ids.add(current.getId());
            queue.addAll(projectRepository.findByParentId(current.getId()));
        }
        return ids;
    }

    private Project resolveParent(UUID userId, UUID parentId) {
        return projectRepository.findById(parentId)
                .filter(p -> p.isOwnedBy(userId))
                .orElseThrow(() -> ValidationException.of("parent_id", "validation.parent_id.invalid"));
    }

    private long incompleteCount(UUID userId, UUID projectId) {
        return TaskCounts.byProject(taskRepository.countIncompleteGroupedByProject(userId))
                .getOrDefault(projectId, 0L);
    }

    private List<ProjectResponse> withCounts(UUID userId, List<Project> projects) {
        Map<UUID, Long> counts = TaskCounts.byProject(taskRepository.countIncompleteGroupedByProject(userId));
        return projects.stream()
                .map(p -> ProjectResponse.from(p, counts.getOrDefault(p.getId(), 0L)))
                .toList();
    }
}

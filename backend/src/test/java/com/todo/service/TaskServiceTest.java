package com.todo.service;

import com.todo.dto.request.CreateTaskRequest;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskService.
 *
 * Tests single-task operations including:
 * - Creation with owned project and tags only
 * - Partial updates distinguishing absent keys from explicit nulls
 * - Completion keeping completed_at in step
 * - Ownership checks (404 before 403)
 * - Deletion failing pending reminders
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TaskService Unit Tests")
class TaskServiceTest {

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private TagRepository tagRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private NotificationRuleRepository ruleRepository;

    @Mock
    private NotificationLogRepository logRepository;

    @InjectMocks
    private TaskService taskService;

    private UUID userId;
    private User user;
    private Task task;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        user = new User("Jane", "jane@example.com", "hash");
        user.setId(userId);

        task = new Task(user, "Write report");
        task.setId(UUID.randomUUID());
    }

    private User otherUser() {
        User other = new User("Bob", "bob@example.com", "hash");
        other.setId(UUID.randomUUID());
        return other;
    }

    @Test
    @DisplayName("create should attach the caller's project and tags")
    void testCreate_WithProjectAndTags() {
        // Arrange
        Project project = new Project(user, "Work");
        project.setId(UUID.randomUUID());
        Tag tag = new Tag(user, "urgent", "#EF4444");
        tag.setId(UUID.randomUUID());

        CreateTaskRequest request = CreateTaskRequest.builder()
                .title("  Write report  ")
                .priority("high")
                .dueDate(LocalDateTime.of(2030, 3, 1, 17, 0))
                .projectId(project.getId())
                .tagIds(List.of(tag.getId(), tag.getId()))
                .build();

        when(userRepository.findById(userId)).thenReturn(Optional.of(user));
        when(projectRepository.findById(project.getId())).thenReturn(Optional.of(project));
        when(tagRepository.findByUserIdAndIdIn(eq(userId), anyCollection())).thenReturn(List.of(tag));
        when(taskRepository.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        TaskResponse response = taskService.create(userId, request);

        // Assert
        assertEquals("Write report", response.getTitle());
        assertEquals("high", response.getPriority());
        assertEquals(project.getId(), response.getProjectId());
        assertEquals(1, response.getTags().size());
        assertFalse(response.getIsCompleted());
    }

    @Test
    @DisplayName("create should reject another user's project")
    void testCreate_ForeignProject() {
        Project foreign = new Project(otherUser(), "Theirs");
        foreign.setId(UUID.randomUUID());
        CreateTaskRequest request = CreateTaskRequest.builder().title("Task").projectId(foreign.getId()).build();

        when(userRepository.findById(userId)).thenReturn(Optional.of(user));
        when(projectRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        ValidationException ex = assertThrows(ValidationException.class, () -> taskService.create(userId, request));
        assertTrue(ex.getErrors().containsKey("project_id"));
        verify(taskRepository, never()).save(any());
    }

    @Test
    @DisplayName("create should reject tag ids the caller does not own")
    void testCreate_UnknownTag() {
        CreateTaskRequest request = CreateTaskRequest.builder()
                .title("Task").tagIds(List.of(UUID.randomUUID())).build();

        when(userRepository.findById(userId)).thenReturn(Optional.of(user));
        when(tagRepository.findByUserIdAndIdIn(eq(userId), anyCollection())).thenReturn(List.of());

        ValidationException ex = assertThrows(ValidationException.class, () -> taskService.create(userId, request));
        assertTrue(ex.getErrors().containsKey("tag_ids"));
    }

    @Test
    @DisplayName("create with is_completed should stamp completed_at")
    void testCreate_Completed() {
        CreateTaskRequest request = CreateTaskRequest.builder().title("Done already").isCompleted(true).build();
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));
        when(taskRepository.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));

        TaskResponse response = taskService.create(userId, request);

        assertTrue(response.getIsCompleted());
        assertNotNull(response.getCompletedAt());
    }

    @Test
    @DisplayName("show should report an unknown task as not found")
    void testShow_NotFound() {
        UUID missing = UUID.randomUUID();
        when(taskRepository.findById(missing)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> taskService.show(userId, missing));
    }

    @Test
    @DisplayName("show should deny access to another user's task")
    void testShow_Foreign() {
        task.setUser(otherUser());
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        assertThrows(UnauthorizedException.class, () -> taskService.show(userId, task.getId()));
    }

    @Test
    @DisplayName("update should leave absent keys alone and clear explicit nulls")
    void testUpdate_Partial() {
        // Arrange
        Project project = new Project(user, "Work");
        project.setId(UUID.randomUUID());
        task.setDescription("keep me");
        task.setDueDate(LocalDateTime.of(2030, 1, 1, 9, 0));
        task.setProject(project);

        UpdateTaskRequest request = new UpdateTaskRequest();
        request.setTitle("Renamed");
        request.setProjectId(null);

        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskRepository.save(task)).thenReturn(task);

        // Act
        TaskResponse response = taskService.update(userId, task.getId(), request);

        // Assert
        assertEquals("Renamed", response.getTitle());
        assertEquals("keep me", response.getDescription());
        assertEquals(LocalDateTime.of(2030, 1, 1, 9, 0), response.getDueDate());
        assertNull(task.getProject());
        verifyNoInteractions(projectRepository);
    }

    @Test
    @DisplayName("update should reject a blank title and replace tags when tag_ids is present")
    void testUpdate_TitleAndTags() {
        Tag old = new Tag(user, "old", "#000000");
        old.setId(UUID.randomUUID());
        task.getTags().add(old);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        UpdateTaskRequest blank = new UpdateTaskRequest();
        blank.setTitle("   ");
        assertThrows(ValidationException.class, () -> taskService.update(userId, task.getId(), blank));

        UpdateTaskRequest clearTags = new UpdateTaskRequest();
        clearTags.setTagIds(null);
        when(taskRepository.save(task)).thenReturn(task);

        taskService.update(userId, task.getId(), clearTags);

        assertTrue(task.getTags().isEmpty());
    }

    @Test
    @DisplayName("setCompleted should set and clear completed_at")
    void testSetCompleted() {
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskRepository.save(task)).thenReturn(task);

        taskService.setCompleted(userId, task.getId(), true);
        assertTrue(task.getIsCompleted());
        assertNotNull(task.getCompletedAt());

        taskService.setCompleted(userId, task.getId(), false);
        assertFalse(task.getIsCompleted());
        assertNull(task.getCompletedAt());
    }

    @Test
    @DisplayName("delete should fail pending reminders before removing rules and the task")
    void testDelete() {
        // Arrange
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        // Act
        taskService.delete(userId, task.getId());

        // Assert
        InOrder order = inOrder(logRepository, ruleRepository, taskRepository);
        order.verify(logRepository).failPendingByTaskId(task.getId(), TaskService.TASK_DELETED_REASON);
        order.verify(logRepository).detachFromTask(task.getId());
        order.verify(ruleRepository).deleteByTaskId(task.getId());
        order.verify(taskRepository).delete(task);
    }

    @Test
    @DisplayName("delete should not touch another user's task")
    void testDelete_Foreign() {
        task.setUser(otherUser());
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        assertThrows(UnauthorizedException.class, () -> taskService.delete(userId, task.getId()));
        verify(taskRepository, never()).delete(any(Task.class));
        verifyNoInteractions(logRepository, ruleRepository);
    }

    @Test
    @DisplayName("options should list statuses and priorities")
    void testOptions() {
        TaskOptionsResponse options = taskService.options();

        assertEquals(List.of("pending", "completed", "all"),
                options.getStatuses().stream().map(OptionItem::getValue).toList());
        assertEquals(Set.of("low", "medium", "high"),
                Set.copyOf(options.getPriorities().stream().map(OptionItem::getValue).toList()));
    }
}

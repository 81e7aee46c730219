package com.todo.service;

import com.todo.dto.response.DataExportResponse;
import com.todo.dto.response.PreferenceResponse;
import com.todo.dto.response.ProjectResponse;
import com.todo.dto.response.SavedViewResponse;
import com.todo.dto.response.TagResponse;
import com.todo.dto.response.TaskResponse;
import com.todo.dto.response.UserResponse;
import com.todo.entity.User;
import com.todo.exception.ResourceNotFoundException;
import com.todo.repository.NotificationLogRepository;
import com.todo.repository.NotificationRuleRepository;
import com.todo.repository.PasswordResetTokenRepository;
import com.todo.repository.ProjectRepository;
import com.todo.repository.SavedViewRepository;
import com.todo.repository.TagRepository;
import com.todo.repository.TaskRepository;
import com.todo.repository.UserNotificationSettingRepository;
import com.todo.repository.UserPreferenceRepository;
import com.todo.repository.UserRepository;
import com.todo.repository.UserSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Whole-account operations: data export and account deletion.
 *
 * Deletion removes rows table by table with bulk statements, children before
 * parents, so that no foreign key is violated and no entity graph is loaded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AccountService {

    private final UserRepository userRepository;
    private final UserSessionRepository sessionRepository;
    private final PasswordResetTokenRepository resetTokenRepository;
    private final UserPreferenceRepository preferenceRepository;
    private final UserNotificationSettingRepository notificationSettingRepository;
    private final TaskRepository taskRepository;
    private final ProjectRepository projectRepository;
    private final TagRepository tagRepository;
    private final SavedViewRepository savedViewRepository;
    private final NotificationRuleRepository ruleRepository;
    private final NotificationLogRepository logRepository;

    @Transactional(readOnly = true)
    public DataExportResponse exportData(UUID userId) {
        User user = loadUser(userId);
        log.info("Exporting data for user {}", userId);

        Map<UUID, Long> projectCounts = TaskCounts.byProject(taskRepository.countIncompleteGroupedByProject(userId));
        Map<UUID, Long> tagCounts = TaskCounts.byTag(taskRepository.countGroupedByTag(userId));
        LocalDateTime now = LocalDateTime.now();

        return DataExportResponse.builder()
                .user(UserResponse.from(user))
                .preferences(preferenceRepository.findByUserId(userId).map(PreferenceResponse::from).orElse(null))
                .tasks(taskRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                        .map(task -> TaskResponse.from(task, now))
                        .toList())
                .projects(projectRepository.findByUserIdOrderByNameAsc(userId).stream()
                        .map(p -> ProjectResponse.from(p, projectCounts.getOrDefault(p.getId(), 0L)))
                        .toList())
                .tags(tagRepository.findByUserIdOrderByNameAsc(userId).stream()
                        .map(t -> TagResponse.from(t, tagCounts.getOrDefault(t.getId(), 0L)))
                        .toList())
                .savedViews(savedViewRepository.findByUserIdOrderByNameAsc(userId).stream()
                        .map(SavedViewResponse::from)
                        .toList())
                .exportedAt(now)
                .build();
    }

    /**
     * Delete the user and every row they own.
     */
    @Transactional
    public void deleteAccount(UUID userId) {
        User user = loadUser(userId);
        log.info("Deleting account {}", userId);

        int logs = logRepository.deleteByUserId(userId);
        int rules = ruleRepository.deleteByUserId(userId);
        notificationSettingRepository.deleteByUserId(userId);

        taskRepository.deleteTagLinksByUserId(userId);
        taskRepository.deleteSubtasksByUserId(userId);
        int tasks = taskRepository.deleteByUserId(userId);

        savedViewRepository.deleteByUserId(userId);
        tagRepository.deleteByUserId(userId);
        projectRepository.clearParentsByUserId(userId);
        int projects = projectRepository.deleteByUserId(userId);

        preferenceRepository.deleteByUserId(userId);
        sessionRepository.deleteByUserId(userId);
        resetTokenRepository.deleteByEmail(user.getEmail());
        userRepository.delete(user);

        log.info("Account {} deleted ({} tasks, {} projects, {} rules, {} logs)",
                userId, tasks, projects, rules, logs);
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
    }
}

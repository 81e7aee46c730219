package com.todo.service;

import com.todo.dto.request.NotificationRuleRequest;
import com.todo.dto.request.NotificationSettingsRequest;
import com.todo.dto.response.NotificationLogResponse;
import com.todo.dto.response.NotificationRuleResponse;
import com.todo.dto.response.NotificationSettingResponse;
import com.todo.entity.NotificationLog;
import com.todo.entity.NotificationRule;
import com.todo.entity.Task;
import com.todo.entity.User;
import com.todo.entity.UserNotificationSetting;
import com.todo.exception.ResourceNotFoundException;
import com.todo.exception.UnauthorizedException;
import com.todo.exception.ValidationException;
import com.todo.repository.NotificationLogRepository;
import com.todo.repository.NotificationRuleRepository;
import com.todo.repository.UserNotificationSettingRepository;
import com.todo.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * User-facing notification management: per-user settings, reminder rules on
 * tasks and the delivery history.
 *
 * Delivery itself is done by {@link NotificationDispatchService}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    public static final int MAX_HISTORY_LIMIT = 100;

    private final UserNotificationSettingRepository settingRepository;
    private final NotificationRuleRepository ruleRepository;
    private final NotificationLogRepository logRepository;
    private final UserRepository userRepository;
    private final TaskService taskService;

    @Value("${app.notifications.history-limit:50}")
    private int defaultHistoryLimit;

    /**
     * The user's settings, created with defaults on first access.
     */
    @Transactional
    public UserNotificationSetting getOrCreateSettings(UUID userId) {
        return settingRepository.findByUserId(userId).orElseGet(() -> {
            User user = userRepository.findById(userId)
                    .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
            log.info("Creating default notification settings for user {}", userId);
            return settingRepository.save(new UserNotificationSetting(user));
        });
    }

    @Transactional
    public NotificationSettingResponse getSettings(UUID userId) {
        return NotificationSettingResponse.from(getOrCreateSettings(userId));
    }

    @Transactional
    public NotificationSettingResponse updateSettings(UUID userId, NotificationSettingsRequest request) {
        UserNotificationSetting setting = getOrCreateSettings(userId);

        if (request.getEmailNotificationsEnabled() != null) {
            setting.setEmailNotificationsEnabled(request.getEmailNotificationsEnabled());
        }
        if (request.getInAppNotificationsEnabled() != null) {
            setting.setInAppNotificationsEnabled(request.getInAppNotificationsEnabled());
        }
        if (request.getTimezone() != null) {
            try {
                setting.setTimezone(ZoneId.of(request.getTimezone().trim()).getId());
            } catch (DateTimeException e) {
                throw ValidationException.of("timezone", "validation.timezone.invalid");
            }
        }
        if (request.getDefaultReminderOffset() != null) {
            setting.setDefaultReminderOffset(request.getDefaultReminderOffset());
        }
        if (request.getDefaultReminderUnit() != null) {
            setting.setDefaultReminderUnit(NotificationRule.ReminderUnit.fromValue(request.getDefaultReminderUnit()));
        }

        setting = settingRepository.save(setting);
        log.info("Notification settings updated for user {}", userId);
        return NotificationSettingResponse.from(setting);
    }

    /**
     * Most recent deliveries first.
     *
     * @param limit 1..100, null for the configured default
     */
    @Transactional(readOnly = true)
    public List<NotificationLogResponse> history(UUID userId, Integer limit) {
        int size = limit == null ? defaultHistoryLimit : limit;
        if (size < 1 || size > MAX_HISTORY_LIMIT) {
            throw ValidationException.of("limit", "validation.limit.between");
        }
        return logRepository.findRecentByUserId(userId, PageRequest.of(0, size)).stream()
                .map(NotificationLogResponse::from)
                .toList();
    }

    @Transactional
    public NotificationLogResponse markAsRead(UUID userId, UUID logId) {
        NotificationLog entry = getOwnedLog(userId, logId);
        entry.markAsRead();
        return NotificationLogResponse.from(logRepository.save(entry));
    }

    @Transactional
    public int markAllAsRead(UUID userId) {
        int count = logRepository.markAllReadByUserId(userId, LocalDateTime.now());
        log.info("Marked {} notifications read for user {}", count, userId);
        return count;
    }

    @Transactional
    public void deleteLog(UUID userId, UUID logId) {
        NotificationLog entry = getOwnedLog(userId, logId);
        logRepository.delete(entry);
    }

    @Transactional(readOnly = true)
    public long unreadCount(UUID userId) {
        return logRepository.countUnreadByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<NotificationRuleResponse> taskRules(UUID userId, UUID taskId) {
        taskService.getOwnedTask(userId, taskId);
        return ruleRepository.findByTaskIdOrderByCreatedAtAsc(taskId).stream()
                .map(NotificationRuleResponse::from)
                .toList();
    }

    /**
     * Add a reminder to a task. Offset and unit fall back to the user's
     * notification settings; the channel falls back to email.
     */
    @Transactional
    public NotificationRuleResponse createRule(UUID userId, UUID taskId, NotificationRuleRequest request) {
        Task task = taskService.getOwnedTask(userId, taskId);
        UserNotificationSetting settings = getOrCreateSettings(userId);

        NotificationRule.Channel channel = request.getChannel() != null
                ? NotificationRule.Channel.fromValue(request.getChannel())
                : NotificationRule.Channel.EMAIL;
        int offset = request.getReminderOffset() != null
                ? request.getReminderOffset()
                : settings.getDefaultReminderOffset();
        NotificationRule.ReminderUnit unit = request.getReminderUnit() != null
                ? NotificationRule.ReminderUnit.fromValue(request.getReminderUnit())
                : settings.getDefaultReminderUnit();

        NotificationRule rule = new NotificationRule(task.getUser(), task, channel, offset, unit);
        if (request.getIsEnabled() != null) {
            rule.setIsEnabled(request.getIsEnabled());
        }

        rule = ruleRepository.save(rule);
        log.info("Notification rule {} created for task {} ({} {} before, {})",
                rule.getId(), taskId, offset, unit.value(), channel.value());
        return NotificationRuleResponse.from(rule);
    }

    @Transactional
    public NotificationRuleResponse updateRule(UUID userId, UUID ruleId, NotificationRuleRequest request) {
        NotificationRule rule = getOwnedRule(userId, ruleId);

        if (request.getChannel() != null) {
            rule.setChannel(NotificationRule.Channel.fromValue(request.getChannel()));
        }
        if (request.getReminderOffset() != null) {
            rule.setReminderOffset(request.getReminderOffset());
        }
        if (request.getReminderUnit() != null) {
            rule.setReminderUnit(NotificationRule.ReminderUnit.fromValue(request.getReminderUnit()));
        }
        if (request.getIsEnabled() != null) {
            rule.setIsEnabled(request.getIsEnabled());
        }

        rule = ruleRepository.save(rule);
        log.info("Notification rule {} updated", ruleId);
        return NotificationRuleResponse.from(rule);
    }

    @Transactional
    public void deleteRule(UUID userId, UUID ruleId) {
        NotificationRule rule = getOwnedRule(userId, ruleId);
        logRepository.detachFromRule(ruleId);
        ruleRepository.delete(rule);
        log.info("Notification rule {} deleted", ruleId);
    }

    @Transactional
    public NotificationRuleResponse toggleRule(UUID userId, UUID ruleId) {
        NotificationRule rule = getOwnedRule(userId, ruleId);
        rule.toggle();
        rule = ruleRepository.save(rule);
        log.info("Notification rule {} {}", ruleId, Boolean.TRUE.equals(rule.getIsEnabled()) ? "enabled" : "disabled");
        return NotificationRuleResponse.from(rule);
    }

    private NotificationRule getOwnedRule(UUID userId, UUID ruleId) {
        NotificationRule rule = ruleRepository.findById(ruleId)
                .orElseThrow(() -> ResourceNotFoundException.of("NotificationRule", ruleId));
        if (!rule.isOwnedBy(userId)) {
            log.warn("User {} attempted to access notification rule {} owned by another user", userId, ruleId);
            throw UnauthorizedException.accessDenied("notification rule", ruleId);
        }
        return rule;
    }

    private NotificationLog getOwnedLog(UUID userId, UUID logId) {
        NotificationLog entry = logRepository.findById(logId)
                .orElseThrow(() -> ResourceNotFoundException.of("Notification", logId));
        if (!entry.isOwnedBy(userId)) {
            log.warn("User {} attempted to access notification {} owned by another user", userId, logId);
            throw UnauthorizedException.accessDenied("notification", logId);
        }
        return entry;
    }
}

package com.todo.service;

import com.todo.entity.NotificationLog;
import com.todo.entity.NotificationRule;
import com.todo.entity.Task;
import com.todo.entity.User;
import com.todo.entity.UserNotificationSetting;
import com.todo.messaging.NotificationReminderProducer;
import com.todo.repository.NotificationLogRepository;
import com.todo.repository.NotificationRuleRepository;
import com.todo.repository.UserNotificationSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reminder delivery pipeline.
 *
 * Processing Flow:
 * 1. {@link #scanAndPublish()} selects the rules that are due now and queues their ids
 * 2. The queue consumer calls {@link #deliver(UUID)} for each id
 * 3. Delivery writes a pending {@link NotificationLog}, sends by channel and
 *    marks the log sent or failed
 * 4. A successful delivery stamps the rule's {@code last_sent_at}, so it never
 *    fires again
 *
 * A rule is selected when it is enabled, has never been sent, its task is
 * incomplete and due, the reminder instant falls in the current due window,
 * there is no successful delivery in the past hour, and the owner has the
 * channel's switch on (in-app switch for in-app rules, email switch for the
 * rest).
 *
 * Error Handling:
 * - Delivery exceptions mark the log failed and leave the rule unsent, so the
 *   next scan retries it while its window is still open
 * - Unsupported channels are logged as failed and leave the rule untouched
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationDispatchService {

    static final long RECENT_SEND_HOURS = 1;

    private final NotificationRuleRepository ruleRepository;
    private final NotificationLogRepository logRepository;
    private final UserNotificationSettingRepository settingRepository;
    private final NotificationReminderProducer producer;
    private final MailService mailService;

    @Value("${app.notifications.due-window-minutes:5}")
    private long dueWindowMinutes;

    /**
     * Queue every rule that is due now.
     *
     * @return the number of rules queued
     */
    @Transactional(readOnly = true)
    public int scanAndPublish() {
        List<UUID> due = findDueRuleIds(LocalDateTime.now());
        int queued = 0;
        for (UUID ruleId : due) {
            try {
                producer.sendReminder(ruleId);
                queued++;
            } catch (AmqpException e) {
                log.error("Could not queue reminder {}; it will be retried on the next scan", ruleId, e);
            }
        }
        return queued;
    }

    /**
     * Number of rules that a scan would queue now, without queueing them.
     */
    @Transactional(readOnly = true)
    public int dryRunCount() {
        int count = findDueRuleIds(LocalDateTime.now()).size();
        log.info("Dry run: {} reminders due", count);
        return count;
    }

    /**
     * Ids of the rules due at {@code now}.
     */
    @Transactional(readOnly = true)
    public List<UUID> findDueRuleIds(LocalDateTime now) {
        // A due rule has offset >= 1 minute, so its task is due after now - window.
        List<NotificationRule> candidates = ruleRepository.findScanCandidates(now.minusMinutes(dueWindowMinutes));

        Map<UUID, UserNotificationSetting> settingsByUser = new HashMap<>();
        LocalDateTime recent = now.minusHours(RECENT_SEND_HOURS);

        return candidates.stream()
                .filter(rule -> rule.isDueAt(now, dueWindowMinutes))
                .filter(rule -> channelEnabled(rule, settingsByUser))
                .filter(rule -> logRepository.countSentSince(rule.getId(), recent) == 0)
                .map(NotificationRule::getId)
                .toList();
    }

    /**
     * Deliver one reminder.
     *
     * @return the status of the written log, or null when the rule was skipped
     */
    @Transactional
    public NotificationLog.Status deliver(UUID ruleId) {
        LocalDateTime now = LocalDateTime.now();

        NotificationRule rule = ruleRepository.findById(ruleId).orElse(null);
        if (rule == null) {
            log.warn("Reminder skipped: rule {} no longer exists", ruleId);
            return null;
        }
        if (!Boolean.TRUE.equals(rule.getIsEnabled())) {
            log.info("Reminder skipped: rule {} is disabled", ruleId);
            return null;
        }
        if (logRepository.countSentSince(ruleId, now.minusHours(RECENT_SEND_HOURS)) > 0) {
            log.info("Reminder skipped: rule {} was sent within the last hour", ruleId);
            return null;
        }

        Task task = rule.getTask();
        User user = rule.getUser();
        NotificationLog entry = logRepository.save(new NotificationLog(rule, user, task, metadata(rule, task)));

        try {
            switch (rule.getChannel()) {
                case EMAIL:
                    mailService.sendTaskReminder(user, task, rule);
                    entry.markAsSent();
                    break;
                case IN_APP:
                    entry.markAsSent();
                    break;
                default:
                    entry.markAsFailed("Unknown channel: " + rule.getChannel().value());
                    logRepository.save(entry);
                    log.warn("Reminder {} not delivered: unsupported channel {}", ruleId, rule.getChannel().value());
                    return entry.getStatus();
            }
        } catch (Exception e) {
            log.error("Reminder delivery failed: ruleId={}, channel={}", ruleId, rule.getChannel().value(), e);
            entry.markAsFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            logRepository.save(entry);
            return entry.getStatus();
        }

        logRepository.save(entry);
        rule.setLastSentAt(now);
        ruleRepository.save(rule);

        log.info("Reminder delivered: ruleId={}, taskId={}, channel={}", ruleId, task.getId(), rule.getChannel().value());
        return entry.getStatus();
    }

    private boolean channelEnabled(NotificationRule rule, Map<UUID, UserNotificationSetting> cache) {
        UUID userId = rule.getUser().getId();
        UserNotificationSetting settings = cache.computeIfAbsent(userId,
                id -> settingRepository.findByUserId(id).orElse(null));
        if (settings == null) {
            return true;
        }
        if (rule.getChannel() == NotificationRule.Channel.IN_APP) {
            return Boolean.TRUE.equals(settings.getInAppNotificationsEnabled());
        }
        return Boolean.TRUE.equals(settings.getEmailNotificationsEnabled());
    }

    private static Map<String, Object> metadata(NotificationRule rule, Task task) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reminder_offset", rule.getReminderOffset());
        metadata.put("reminder_unit", rule.getReminderUnit().value());
        metadata.put("due_date", task.getDueDate() != null ? task.getDueDate().toString() : null);
        metadata.put("task_title", task.getTitle());
        return metadata;
    }
}

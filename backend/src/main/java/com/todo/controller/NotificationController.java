package com.todo.controller;

import com.todo.dto.request.NotificationRuleRequest;
import com.todo.dto.request.NotificationSettingsRequest;
import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.NotificationLogResponse;
import com.todo.dto.response.NotificationRuleResponse;
import com.todo.dto.response.NotificationSettingResponse;
import com.todo.security.CurrentUser;
import com.todo.service.NotificationService;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Getter;
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
 * REST Controller for reminders.
 *
 * Covers the per-user notification settings, the delivery history and the
 * reminder rules attached to tasks. Delivery itself runs in the background
 * scheduler and the RabbitMQ consumer.
 *
 * Endpoints:
 * - GET/PUT /api/notifications/settings
 * - GET /api/notifications/history?limit=50
 * - POST /api/notifications/{id}/read, POST /api/notifications/mark-all-read
 * - DELETE /api/notifications/{id}, GET /api/notifications/unread-count
 * - GET/POST /api/tasks/{taskId}/notifications
 * - PUT/DELETE /api/notifications/rules/{ruleId}, POST /api/notifications/rules/{ruleId}/toggle
 *
 * @see com.todo.service.NotificationService
 * @see com.todo.scheduler.NotificationReminderScheduler
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private final NotificationService notificationService;
    private final MessageSourceAccessor messages;

    @GetMapping("/notifications/settings")
    public ResponseEntity<ApiResponse<NotificationSettingResponse>> getSettings(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(notificationService.getSettings(CurrentUser.userId(authentication))));
    }

    @PutMapping("/notifications/settings")
    public ResponseEntity<ApiResponse<NotificationSettingResponse>> updateSettings(
            Authentication authentication,
            @Valid @RequestBody NotificationSettingsRequest request) {

        log.info("Notification settings update requested by user: {}", authentication.getName());
        NotificationSettingResponse settings = notificationService.updateSettings(
                CurrentUser.userId(authentication), request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("notification.settings_updated"), settings));
    }

    /**
     * Most recent deliveries first.
     *
     * @param limit maximum number of entries, 1..100; defaults to 50
     */
    @GetMapping("/notifications/history")
    public ResponseEntity<ApiResponse<List<NotificationLogResponse>>> history(
            Authentication authentication,
            @RequestParam(required = false) Integer limit) {

        return ResponseEntity.ok(ApiResponse.ok(notificationService.history(CurrentUser.userId(authentication), limit)));
    }

    @PostMapping("/notifications/{id}/read")
    public ResponseEntity<ApiResponse<NotificationLogResponse>> markAsRead(
            Authentication authentication,
            @PathVariable UUID id) {

        return ResponseEntity.ok(ApiResponse.ok(notificationService.markAsRead(CurrentUser.userId(authentication), id)));
    }

    @PostMapping("/notifications/mark-all-read")
    public ResponseEntity<CountResponse> markAllAsRead(Authentication authentication) {
        int updated = notificationService.markAllAsRead(CurrentUser.userId(authentication));
        return ResponseEntity.ok(new CountResponse(updated));
    }

    @DeleteMapping("/notifications/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteLog(
            Authentication authentication,
            @PathVariable UUID id) {

        notificationService.deleteLog(CurrentUser.userId(authentication), id);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("notification.deleted")));
    }

    @GetMapping("/notifications/unread-count")
    public ResponseEntity<CountResponse> unreadCount(Authentication authentication) {
        return ResponseEntity.ok(new CountResponse(notificationService.unreadCount(CurrentUser.userId(authentication))));
    }

    @GetMapping("/tasks/{taskId}/notifications")
    public ResponseEntity<ApiResponse<List<NotificationRuleResponse>>> taskRules(
            Authentication authentication,
            @PathVariable UUID taskId) {

        return ResponseEntity.ok(ApiResponse.ok(notificationService.taskRules(CurrentUser.userId(authentication), taskId)));
    }

    /**
     * Attach a reminder to a task. Channel, offset and unit fall back to the
     * user's notification settings when omitted.
     */
    @PostMapping("/tasks/{taskId}/notifications")
    public ResponseEntity<ApiResponse<NotificationRuleResponse>> createRule(
            Authentication authentication,
            @PathVariable UUID taskId,
            @Valid @RequestBody NotificationRuleRequest request) {

        log.info("Reminder creation requested for task: {} by user: {}", taskId, authentication.getName());

        try {
            NotificationRuleResponse rule = notificationService.createRule(
                    CurrentUser.userId(authentication), taskId, request);
            return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(messages.getMessage("reminder.created"), rule));

        } catch (Exception e) {
            log.error("Failed to create reminder for task: {} by user: {}", taskId, authentication.getName(), e);
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    @PutMapping("/notifications/rules/{ruleId}")
    public ResponseEntity<ApiResponse<NotificationRuleResponse>> updateRule(
            Authentication authentication,
            @PathVariable UUID ruleId,
            @Valid @RequestBody NotificationRuleRequest request) {

        NotificationRuleResponse rule = notificationService.updateRule(CurrentUser.userId(authentication), ruleId, request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("reminder.updated"), rule));
    }

    @DeleteMapping("/notifications/rules/{ruleId}")
    public ResponseEntity<ApiResponse<Void>> deleteRule(
            Authentication authentication,
            @PathVariable UUID ruleId) {

        notificationService.deleteRule(CurrentUser.userId(authentication), ruleId);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("reminder.deleted")));
    }

    @PostMapping("/notifications/rules/{ruleId}/toggle")
    public ResponseEntity<ApiResponse<NotificationRuleResponse>> toggleRule(
            Authentication authentication,
            @PathVariable UUID ruleId) {

        return ResponseEntity.ok(ApiResponse.ok(notificationService.toggleRule(CurrentUser.userId(authentication), ruleId)));
    }

    @Getter
    @AllArgsConstructor
    public static class CountResponse {

        private final long count;
    }
}

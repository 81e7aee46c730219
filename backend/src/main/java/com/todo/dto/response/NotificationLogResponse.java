package com.todo.dto.response;

import com.todo.entity.NotificationLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * One entry of the notification history. The task may have been deleted since,
 * in which case {@code task_id} is null and the title is taken from the metadata
 * captured at delivery time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationLogResponse {

    private UUID id;

    private UUID ruleId;

    private UUID taskId;

    private String taskTitle;

    private String channel;

    private String channelLabel;

    private String status;

    private String statusLabel;

    private LocalDateTime sentAt;

    private LocalDateTime readAt;

    private Boolean isRead;

    private String errorMessage;

    private Map<String, Object> metadata;

    private LocalDateTime createdAt;

    public static NotificationLogResponse from(NotificationLog log) {
        String title = log.getTask() != null ? log.getTask().getTitle() : null;
        if (title == null && log.getMetadata() != null && log.getMetadata().get("task_title") != null) {
            title = String.valueOf(log.getMetadata().get("task_title"));
        }
        return NotificationLogResponse.builder()
                .id(log.getId())
                .ruleId(log.getRule() != null ? log.getRule().getId() : null)
                .taskId(log.getTask() != null ? log.getTask().getId() : null)
                .taskTitle(title)
                .channel(log.getChannel().value())
                .channelLabel(log.getChannel().getLabel())
                .status(log.getStatus().value())
                .statusLabel(log.getStatus().getLabel())
                .sentAt(log.getSentAt())
                .readAt(log.getReadAt())
                .isRead(log.getReadAt() != null)
                .errorMessage(log.getErrorMessage())
                .metadata(log.getMetadata())
                .createdAt(log.getCreatedAt())
                .build();
    }
}

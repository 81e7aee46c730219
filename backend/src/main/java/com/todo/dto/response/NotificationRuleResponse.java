package com.todo.dto.response;

import com.todo.entity.NotificationRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRuleResponse {

    private UUID id;

    private UUID taskId;

    private String channel;

    private String channelLabel;

    private Integer reminderOffset;

    private String reminderUnit;

    /**
     * e.g. "in 30 minutes".
     */
    private String reminderText;

    /**
     * When the reminder fires; null while the task has no due date.
     */
    private LocalDateTime reminderTime;

    private Boolean isEnabled;

    private LocalDateTime lastSentAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static NotificationRuleResponse from(NotificationRule rule) {
        return NotificationRuleResponse.builder()
                .id(rule.getId())
                .taskId(rule.getTask().getId())
                .channel(rule.getChannel().value())
                .channelLabel(rule.getChannel().getLabel())
                .reminderOffset(rule.getReminderOffset())
                .reminderUnit(rule.getReminderUnit().value())
                .reminderText(rule.getReminderText())
                .reminderTime(rule.getReminderDateTime())
                .isEnabled(rule.getIsEnabled())
                .lastSentAt(rule.getLastSentAt())
                .createdAt(rule.getCreatedAt())
                .updatedAt(rule.getUpdatedAt())
                .build();
    }
}

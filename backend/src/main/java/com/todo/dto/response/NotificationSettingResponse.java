package com.todo.dto.response;

import com.todo.entity.UserNotificationSetting;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSettingResponse {

    private Boolean emailNotificationsEnabled;

    private Boolean inAppNotificationsEnabled;

    private String timezone;

    private Integer defaultReminderOffset;

    private String defaultReminderUnit;

    private String defaultReminderText;

    private LocalDateTime updatedAt;

    public static NotificationSettingResponse from(UserNotificationSetting setting) {
        return NotificationSettingResponse.builder()
                .emailNotificationsEnabled(setting.getEmailNotificationsEnabled())
                .inAppNotificationsEnabled(setting.getInAppNotificationsEnabled())
                .timezone(setting.getTimezone())
                .defaultReminderOffset(setting.getDefaultReminderOffset())
                .defaultReminderUnit(setting.getDefaultReminderUnit().value())
                .defaultReminderText(setting.getDefaultReminderText())
                .updatedAt(setting.getUpdatedAt())
                .build();
    }
}

package com.todo.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSettingsRequest {

    private Boolean emailNotificationsEnabled;

    private Boolean inAppNotificationsEnabled;

    @Size(max = 64, message = "{validation.timezone.max}")
    private String timezone;

    @Min(value = 1, message = "{validation.default_reminder_offset.min}")
    private Integer defaultReminderOffset;

    @Pattern(regexp = "minutes|hours|days", message = "{validation.default_reminder_unit.invalid}")
    private String defaultReminderUnit;
}

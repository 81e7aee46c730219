package com.todo.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Creates or updates a reminder rule. On create, a missing offset or unit is
 * taken from the user's notification settings and a missing channel means email.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRuleRequest {

    @Pattern(regexp = "email|sms|push|in_app", message = "{validation.channel.invalid}")
    private String channel;

    @Min(value = 1, message = "{validation.reminder_offset.min}")
    private Integer reminderOffset;

    @Pattern(regexp = "minutes|hours|days", message = "{validation.reminder_unit.invalid}")
    private String reminderUnit;

    private Boolean isEnabled;
}

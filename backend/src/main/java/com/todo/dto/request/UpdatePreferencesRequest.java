package com.todo.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * The user-editable preference fields. Keys outside this list are ignored by
 * Jackson; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePreferencesRequest {

    @Pattern(regexp = "light|dark|system", message = "{validation.theme.invalid}")
    private String theme;

    @Pattern(regexp = "en|fa", message = "{validation.language.invalid}")
    private String language;

    @Pattern(regexp = "gregorian|jalali", message = "{validation.calendar_type.invalid}")
    private String calendarType;

    private Boolean emailNotifications;

    private Boolean pushNotifications;

    private Boolean taskReminders;

    private Boolean dailyDigest;

    private Boolean weeklyDigest;

    private Boolean marketingEmails;

    @Min(value = 5, message = "{validation.session_timeout.min}")
    @Max(value = 1440, message = "{validation.session_timeout.max}")
    private Integer sessionTimeout;

    @Min(value = 5, message = "{validation.items_per_page.min}")
    @Max(value = 100, message = "{validation.items_per_page.max}")
    private Integer itemsPerPage;

    @Size(max = 20, message = "{validation.date_format.max}")
    private String dateFormat;

    @Size(max = 20, message = "{validation.time_format.max}")
    private String timeFormat;

    @Min(value = 0, message = "{validation.start_of_week.between}")
    @Max(value = 6, message = "{validation.start_of_week.between}")
    private Integer startOfWeek;

    @Pattern(regexp = "list|calendar|board", message = "{validation.default_task_view.invalid}")
    private String defaultTaskView;

    private Boolean showWeekNumbers;

    private Boolean reducedMotion;

    private Boolean highContrast;

    @DecimalMin(value = "0.8", message = "{validation.font_scale.min}")
    @DecimalMax(value = "1.5", message = "{validation.font_scale.max}")
    private BigDecimal fontScale;
}

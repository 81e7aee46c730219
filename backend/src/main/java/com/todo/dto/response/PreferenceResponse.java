package com.todo.dto.response;

import com.todo.entity.UserPreference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferenceResponse {

    private String theme;

    private String language;

    private String calendarType;

    private Boolean emailNotifications;

    private Boolean pushNotifications;

    private Boolean taskReminders;

    private Boolean dailyDigest;

    private Boolean weeklyDigest;

    private Boolean marketingEmails;

    private Integer sessionTimeout;

    private Integer itemsPerPage;

    private String dateFormat;

    private String timeFormat;

    private Integer startOfWeek;

    private String defaultTaskView;

    private Boolean showWeekNumbers;

    private Boolean reducedMotion;

    private Boolean highContrast;

    private BigDecimal fontScale;

    private LocalDateTime updatedAt;

    public static PreferenceResponse from(UserPreference preference) {
        return PreferenceResponse.builder()
                .theme(preference.getTheme())
                .language(preference.getLanguage())
                .calendarType(preference.getCalendarType())
                .emailNotifications(preference.getEmailNotifications())
                .pushNotifications(preference.getPushNotifications())
                .taskReminders(preference.getTaskReminders())
                .dailyDigest(preference.getDailyDigest())
                .weeklyDigest(preference.getWeeklyDigest())
                .marketingEmails(preference.getMarketingEmails())
                .sessionTimeout(preference.getSessionTimeout())
                .itemsPerPage(preference.getItemsPerPage())
                .dateFormat(preference.getDateFormat())
                .timeFormat(preference.getTimeFormat())
                .startOfWeek(preference.getStartOfWeek())
                .defaultTaskView(preference.getDefaultTaskView())
                .showWeekNumbers(preference.getShowWeekNumbers())
                .reducedMotion(preference.getReducedMotion())
                .highContrast(preference.getHighContrast())
                .fontScale(preference.getFontScale())
                .updatedAt(preference.getUpdatedAt())
                .build();
    }
}
